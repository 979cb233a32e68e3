package com.project.image.bichrome.DTOs;

import java.nio.file.Path;

public record ConversionResult(
        Path output,
        int width,
        int height,
        int lightPixels,   // counted before resizing
        long outputBytes
) {}
