package com.project.image.bichrome.service;

import com.project.image.bichrome.DTOs.BinaryMask;
import com.project.image.bichrome.DTOs.RgbColor;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;

/** Paints a mask with two colors. Output only ever contains those two values. */
@Service
public class ColorMappingService {

    public BufferedImage recolor(BinaryMask mask, RgbColor darkColor, RgbColor lightColor) {
        // index 0 = dark, 1 = light
        final int[] palette = {darkColor.toRgb(), lightColor.toRgb()};

        BufferedImage out = new BufferedImage(mask.width(), mask.height(), BufferedImage.TYPE_INT_RGB);
        int[] pixels = ((DataBufferInt) out.getRaster().getDataBuffer()).getData();
        boolean[] light = mask.light();
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = palette[light[i] ? 1 : 0];
        }
        return out;
    }
}
