package com.project.image.bichrome;

import com.project.image.bichrome.DTOs.ResizeDimensions;
import com.project.image.bichrome.exceptions.InvalidDimensionsException;
import com.project.image.bichrome.service.ResizeService;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResizeServiceTest {

    @ParameterizedTest
    @CsvSource({
            "true, 30, 20",
            "true, 250, 90",
            "true, 1, 1",
            "false, 30, 20",
            "false, 250, 90",
            "false, 7, 300"
    })
    void resize_producesExactlyTheRequestedSize(boolean useOpenCv, int w, int h) {
        ResizeService service = new ResizeService(useOpenCv);

        BufferedImage out = service.resize(SampleImages.scene(120, 80), Optional.of(new ResizeDimensions(w, h)));

        assertThat(out.getWidth()).isEqualTo(w);
        assertThat(out.getHeight()).isEqualTo(h);
        assertThat(out.getType()).isEqualTo(BufferedImage.TYPE_INT_RGB);
    }

    @Test
    void noDimensions_returnsSameImage() {
        BufferedImage img = SampleImages.scene(40, 30);

        assertThat(new ResizeService().resize(img, Optional.empty())).isSameAs(img);
    }

    @ParameterizedTest
    @CsvSource({"0, 10", "10, 0", "-5, 10", "10, -1"})
    void nonPositiveDimensions_areRejected(int w, int h) {
        assertThatThrownBy(() -> new ResizeDimensions(w, h))
                .isInstanceOf(InvalidDimensionsException.class)
                .hasMessageContaining("positive");
    }

    @Test
    void parse_acceptsWidthByHeight() {
        assertThat(ResizeDimensions.parse("800x600")).isEqualTo(new ResizeDimensions(800, 600));
        assertThat(ResizeDimensions.parse(" 32 X 16 ")).isEqualTo(new ResizeDimensions(32, 16));
    }

    @ParameterizedTest
    @ValueSource(strings = {"800", "axb", "0x10", "10x", "1x2x3"})
    void parse_rejectsMalformedInput(String text) {
        assertThatThrownBy(() -> ResizeDimensions.parse(text)).isInstanceOf(InvalidDimensionsException.class);
    }
}
