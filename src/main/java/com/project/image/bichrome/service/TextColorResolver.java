package com.project.image.bichrome.service;

import com.project.image.bichrome.DTOs.ColorResolution;
import com.project.image.bichrome.DTOs.ColorRole;
import com.project.image.bichrome.DTOs.RgbColor;

/**
 * Resolves colors typed into a form. Blank means "use the default";
 * anything else must parse as a color or the request is rejected.
 */
public class TextColorResolver implements ColorResolver {

    private final String darkText;
    private final String lightText;

    public TextColorResolver(String darkText, String lightText) {
        this.darkText = darkText;
        this.lightText = lightText;
    }

    @Override
    public ColorResolution resolve(ColorRole role, RgbColor defaultColor) {
        String text = role == ColorRole.DARK ? darkText : lightText;
        if (text == null || text.isBlank()) {
            return ColorResolution.of(defaultColor);
        }
        try {
            return ColorResolution.of(RgbColor.parse(text));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + role.label() + " color: " + e.getMessage(), e);
        }
    }
}
