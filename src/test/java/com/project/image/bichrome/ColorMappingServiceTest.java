package com.project.image.bichrome;

import com.project.image.bichrome.DTOs.BinaryMask;
import com.project.image.bichrome.DTOs.RgbColor;
import com.project.image.bichrome.service.ColorMappingService;
import com.project.image.bichrome.service.ThresholdService;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ColorMappingServiceTest {
    private final ColorMappingService service = new ColorMappingService();

    @Test
    void recolor_paintsEachClassWithItsColor() {
        BinaryMask mask = new BinaryMask(2, 2, new boolean[]{false, true, true, false});
        RgbColor dark = new RgbColor(10, 20, 30);
        RgbColor light = new RgbColor(200, 150, 100);

        BufferedImage out = service.recolor(mask, dark, light);

        assertThat(out.getType()).isEqualTo(BufferedImage.TYPE_INT_RGB);
        assertThat(out.getRGB(0, 0) & 0xFFFFFF).isEqualTo(dark.toRgb());
        assertThat(out.getRGB(1, 0) & 0xFFFFFF).isEqualTo(light.toRgb());
        assertThat(out.getRGB(0, 1) & 0xFFFFFF).isEqualTo(light.toRgb());
        assertThat(out.getRGB(1, 1) & 0xFFFFFF).isEqualTo(dark.toRgb());
    }

    @Test
    void output_containsOnlyTheTwoColors() {
        BinaryMask mask = new ThresholdService().threshold(SampleImages.scene(64, 48));

        BufferedImage out = service.recolor(mask, RgbColor.BLACK, RgbColor.PAPER);

        Set<Integer> seen = new HashSet<>();
        for (int y = 0; y < out.getHeight(); y++) {
            for (int x = 0; x < out.getWidth(); x++) {
                seen.add(out.getRGB(x, y) & 0xFFFFFF);
            }
        }
        assertThat(seen).containsExactlyInAnyOrder(RgbColor.BLACK.toRgb(), RgbColor.PAPER.toRgb());
        assertThat(out.getWidth()).isEqualTo(64);
        assertThat(out.getHeight()).isEqualTo(48);
    }
}
