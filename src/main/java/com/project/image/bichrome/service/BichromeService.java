package com.project.image.bichrome.service;

import com.project.image.bichrome.DTOs.BinaryMask;
import com.project.image.bichrome.DTOs.ConversionResult;
import com.project.image.bichrome.DTOs.DecodedImage;
import com.project.image.bichrome.DTOs.ProcessingRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * Single-image pipeline: decode, threshold, recolor, optional resize, encode.
 * Any failure aborts this image and propagates to the caller.
 */
@Service
public class BichromeService {
    private static final Logger log = LoggerFactory.getLogger(BichromeService.class);

    private final ImageReaderService readerService;
    private final ThresholdService thresholdService;
    private final ColorMappingService colorMappingService;
    private final ResizeService resizeService;
    private final ImageEncoderService encoderService;

    public BichromeService(ImageReaderService readerService,
                           ThresholdService thresholdService,
                           ColorMappingService colorMappingService,
                           ResizeService resizeService,
                           ImageEncoderService encoderService) {
        this.readerService = readerService;
        this.thresholdService = thresholdService;
        this.colorMappingService = colorMappingService;
        this.resizeService = resizeService;
        this.encoderService = encoderService;
    }

    public ConversionResult process(Path source, Path destination, ProcessingRequest request) {
        log.info("Converting {} -> {} (dark={}, light={}, cleanup={}, resize={})",
                source.getFileName(), destination, request.darkColor().toHex(), request.lightColor().toHex(),
                request.cleanup(), request.resize().map(Object::toString).orElse("none"));

        DecodedImage decoded = readerService.read(source);
        log.debug("Source {} is {} {}x{}", source.getFileName(), decoded.formatName(), decoded.width(), decoded.height());
        BinaryMask mask = thresholdService.threshold(decoded.image());
        BufferedImage output = render(mask, request);

        long bytes = encoderService.write(output, destination, request.cleanup(), decoded.textEntries());
        return new ConversionResult(destination, output.getWidth(), output.getHeight(), mask.lightCount(), bytes);
    }

    /** In-memory part of the pipeline, without decoding or encoding. */
    public BufferedImage convert(BufferedImage source, ProcessingRequest request) {
        return render(thresholdService.threshold(source), request);
    }

    private BufferedImage render(BinaryMask mask, ProcessingRequest request) {
        BufferedImage recolored = colorMappingService.recolor(mask, request.darkColor(), request.lightColor());
        return resizeService.resize(recolored, request.resize());
    }
}
