package com.project.image.bichrome;

import com.project.image.bichrome.DTOs.ConversionResult;
import com.project.image.bichrome.DTOs.ProcessingRequest;
import com.project.image.bichrome.DTOs.ResizeDimensions;
import com.project.image.bichrome.DTOs.RgbColor;
import com.project.image.bichrome.exceptions.ImageDecodeException;
import com.project.image.bichrome.exceptions.ImageEncodeException;
import com.project.image.bichrome.service.BichromeService;
import com.project.image.bichrome.service.ColorMappingService;
import com.project.image.bichrome.service.ImageEncoderService;
import com.project.image.bichrome.service.ImageReaderService;
import com.project.image.bichrome.service.ResizeService;
import com.project.image.bichrome.service.ThresholdService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Optional;
import javax.imageio.ImageIO;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BichromeServiceTest {
    private final BichromeService service = newService();

    @TempDir
    Path tmp;

    static BichromeService newService() {
        return new BichromeService(new ImageReaderService(), new ThresholdService(), new ColorMappingService(),
                new ResizeService(), new ImageEncoderService(0.95f, 0.85f));
    }

    @Test
    void twoByTwoExample_mapsToDefaultColors() {
        BufferedImage source = SampleImages.gray(2, 2, 10, 200, 128, 129);

        BufferedImage out = service.convert(source, ProcessingRequest.defaults());

        assertThat(out.getRGB(0, 0) & 0xFFFFFF).isEqualTo(0x000000);
        assertThat(out.getRGB(1, 0) & 0xFFFFFF).isEqualTo(0xF3EFDD);
        assertThat(out.getRGB(0, 1) & 0xFFFFFF).isEqualTo(0x000000);
        assertThat(out.getRGB(1, 1) & 0xFFFFFF).isEqualTo(0xF3EFDD);
    }

    @Test
    void process_keepsDimensionsWithoutResize() throws Exception {
        Path source = SampleImages.write(SampleImages.scene(90, 60), tmp.resolve("scene.png"), "png");

        ConversionResult result = service.process(source, tmp.resolve("out.png"), ProcessingRequest.defaults());

        BufferedImage written = ImageIO.read(result.output().toFile());
        assertThat(written.getWidth()).isEqualTo(90);
        assertThat(written.getHeight()).isEqualTo(60);
        assertThat(result.lightPixels()).isPositive();
        assertThat(result.outputBytes()).isPositive();
    }

    @Test
    void process_resizesToRequestedDimensions() throws Exception {
        Path source = SampleImages.write(SampleImages.scene(90, 60), tmp.resolve("scene.jpg"), "jpg");
        ProcessingRequest request = new ProcessingRequest(RgbColor.BLACK, RgbColor.PAPER, true,
                Optional.of(new ResizeDimensions(45, 100)));

        ConversionResult result = service.process(source, tmp.resolve("out.jpg"), request);

        BufferedImage written = ImageIO.read(result.output().toFile());
        assertThat(written.getWidth()).isEqualTo(45);
        assertThat(written.getHeight()).isEqualTo(100);
        assertThat(result.width()).isEqualTo(45);
        assertThat(result.height()).isEqualTo(100);
    }

    @Test
    void rerunOnOwnOutput_isIdenticalWithDefaultColors() throws Exception {
        Path source = SampleImages.write(SampleImages.scene(64, 64), tmp.resolve("scene.png"), "png");
        Path first = tmp.resolve("first.png");
        Path second = tmp.resolve("second.png");

        service.process(source, first, ProcessingRequest.defaults());
        service.process(first, second, ProcessingRequest.defaults());

        BufferedImage a = ImageIO.read(first.toFile());
        BufferedImage b = ImageIO.read(second.toFile());
        for (int y = 0; y < a.getHeight(); y++) {
            for (int x = 0; x < a.getWidth(); x++) {
                assertThat(b.getRGB(x, y)).as("pixel %d,%d", x, y).isEqualTo(a.getRGB(x, y));
            }
        }
    }

    @Test
    void customColors_areUsed() {
        RgbColor navy = new RgbColor(0, 0, 128);
        RgbColor cream = RgbColor.parse("#fffdd0");
        ProcessingRequest request = new ProcessingRequest(navy, cream, false, Optional.empty());

        BufferedImage out = service.convert(SampleImages.gray(2, 1, 0, 255), request);

        assertThat(out.getRGB(0, 0) & 0xFFFFFF).isEqualTo(navy.toRgb());
        assertThat(out.getRGB(1, 0) & 0xFFFFFF).isEqualTo(cream.toRgb());
    }

    @Test
    void corruptSource_failsWithDecodeError() throws Exception {
        Path source = SampleImages.corrupt(tmp.resolve("broken.png"));

        assertThatThrownBy(() -> service.process(source, tmp.resolve("out.png"), ProcessingRequest.defaults()))
                .isInstanceOf(ImageDecodeException.class)
                .hasMessageContaining("broken.png");
    }

    @Test
    void unwritableDestination_failsWithEncodeError() throws Exception {
        Path source = SampleImages.write(SampleImages.scene(10, 10), tmp.resolve("scene.png"), "png");

        assertThatThrownBy(() -> service.process(source, tmp.resolve("nope").resolve("out.png"), ProcessingRequest.defaults()))
                .isInstanceOf(ImageEncodeException.class);
    }
}
