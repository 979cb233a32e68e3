package com.project.image.bichrome.service;

import com.project.image.bichrome.DTOs.ColorResolution;
import com.project.image.bichrome.DTOs.ColorRole;
import com.project.image.bichrome.DTOs.RgbColor;

/**
 * Source of the replacement colors. The pipeline only sees the resolved colors,
 * never how an operator picked them.
 */
@FunctionalInterface
public interface ColorResolver {

    /**
     * @param role         which class the color replaces
     * @param defaultColor configured fallback for that class
     * @return the chosen color, or {@link ColorResolution#cancelled()} if the operator backed out
     */
    ColorResolution resolve(ColorRole role, RgbColor defaultColor);
}
