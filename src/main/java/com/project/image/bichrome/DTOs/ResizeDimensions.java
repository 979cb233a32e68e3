package com.project.image.bichrome.DTOs;

import com.project.image.bichrome.exceptions.InvalidDimensionsException;

/** Target size of the resize stage; both sides strictly positive. */
public record ResizeDimensions(int width, int height) {

    public ResizeDimensions {
        if (width <= 0 || height <= 0) {
            throw new InvalidDimensionsException(
                    "Resize dimensions must be positive (was " + width + "x" + height + ")");
        }
    }

    /** Parses "WxH", e.g. "800x600". */
    public static ResizeDimensions parse(String text) {
        if (text == null) {
            throw new InvalidDimensionsException("Resize dimensions are missing");
        }
        String[] parts = text.trim().toLowerCase().split("x");
        if (parts.length != 2) {
            throw new InvalidDimensionsException("Expected WIDTHxHEIGHT but got: " + text);
        }
        try {
            return new ResizeDimensions(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new InvalidDimensionsException("Width and height must be integers: " + text);
        }
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
