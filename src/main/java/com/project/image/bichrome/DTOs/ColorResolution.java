package com.project.image.bichrome.DTOs;

import java.util.Optional;

/** Outcome of asking an operator for a color: a color, or a cancelled selection. */
public record ColorResolution(Optional<RgbColor> color) {

    private static final ColorResolution CANCELLED = new ColorResolution(Optional.empty());

    public static ColorResolution of(RgbColor color) {
        return new ColorResolution(Optional.of(color));
    }

    public static ColorResolution cancelled() {
        return CANCELLED;
    }

    public boolean isCancelled() {
        return color.isEmpty();
    }
}
