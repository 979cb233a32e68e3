package com.project.image.bichrome.DTOs;

import java.util.Objects;
import java.util.Optional;

/**
 * Settings for one run, single image or a whole folder.
 *
 * @param darkColor  color painted where the source is dark
 * @param lightColor color painted where the source is light
 * @param cleanup    strip metadata and re-encode for a smaller file
 * @param resize     optional output size
 */
public record ProcessingRequest(
        RgbColor darkColor,
        RgbColor lightColor,
        boolean cleanup,
        Optional<ResizeDimensions> resize
) {
    public ProcessingRequest {
        Objects.requireNonNull(darkColor, "darkColor");
        Objects.requireNonNull(lightColor, "lightColor");
        resize = resize == null ? Optional.empty() : resize;
    }

    public static ProcessingRequest defaults() {
        return new ProcessingRequest(RgbColor.BLACK, RgbColor.PAPER, false, Optional.empty());
    }
}
