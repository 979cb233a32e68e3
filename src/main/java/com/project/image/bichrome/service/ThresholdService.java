package com.project.image.bichrome.service;

import com.project.image.bichrome.DTOs.BinaryMask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;

/**
 * Classifies each pixel as light or dark by its ITU-R 601 luma.
 * A pixel is light only when its luminance is strictly above {@link #THRESHOLD}.
 */
@Service
public class ThresholdService {
    private static final Logger log = LoggerFactory.getLogger(ThresholdService.class);

    public static final int THRESHOLD = 128;

    public BinaryMask threshold(BufferedImage image) {
        final int w = image.getWidth(), h = image.getHeight();
        boolean[] light = new boolean[w * h];

        if (isGray(image)) {
            thresholdGraySamples(image.getRaster(), light, w, h);
        } else {
            int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
            for (int i = 0; i < argb.length; i++) {
                int p = argb[i];
                light[i] = luminance((p >> 16) & 0xFF, (p >> 8) & 0xFF, p & 0xFF) > THRESHOLD;
            }
        }

        BinaryMask mask = new BinaryMask(w, h, light);
        log.debug("Thresholded {}x{} image: {} light pixels", w, h, mask.lightCount());
        return mask;
    }

    /** Fixed-point form of 0.299 R + 0.587 G + 0.114 B, rounded. */
    public static int luminance(int r, int g, int b) {
        return (r * 19595 + g * 38470 + b * 7471 + 0x8000) >> 16;
    }

    // Gray rasters are read directly: getRGB() would push them through a gamma conversion.
    // Band 0 is the gray channel; an alpha band, if any, is ignored.
    private static void thresholdGraySamples(Raster raster, boolean[] light, int w, int h) {
        int bits = raster.getSampleModel().getSampleSize(0);
        int max = (1 << bits) - 1;
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            raster.getSamples(raster.getMinX(), raster.getMinY() + y, w, 1, 0, row);
            for (int x = 0; x < w; x++) {
                int value = bits == 8 ? row[x] : scaleTo8Bits(row[x], bits, max);
                light[y * w + x] = value > THRESHOLD;
            }
        }
    }

    private static int scaleTo8Bits(int sample, int bits, int max) {
        if (bits > 8) {
            return sample >> (bits - 8);
        }
        return sample * 255 / max;
    }

    private static boolean isGray(BufferedImage image) {
        ColorModel cm = image.getColorModel();
        return !(cm instanceof IndexColorModel)
                && cm.getColorSpace().getType() == ColorSpace.TYPE_GRAY;
    }
}
