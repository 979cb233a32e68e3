package com.project.image.bichrome.DTOs;

import java.util.Locale;

/**
 * An sRGB color with 8-bit channels.
 * Accepts "#rrggbb", "rrggbb" and "r,g,b" when parsed from text.
 */
public record RgbColor(int red, int green, int blue) {

    public static final RgbColor BLACK = new RgbColor(0, 0, 0);
    public static final RgbColor PAPER = new RgbColor(243, 239, 221);

    public RgbColor {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    public static RgbColor parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Color value is empty");
        }
        String value = text.trim();
        if (value.contains(",")) {
            String[] parts = value.split(",");
            if (parts.length != 3) {
                throw new IllegalArgumentException("Expected r,g,b but got: " + text);
            }
            try {
                return new RgbColor(Integer.parseInt(parts[0].trim()),
                        Integer.parseInt(parts[1].trim()),
                        Integer.parseInt(parts[2].trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("RGB values must be integers between 0 and 255: " + text, e);
            }
        }
        String hex = value.startsWith("#") ? value.substring(1) : value;
        if (!hex.matches("[0-9a-fA-F]{6}")) {
            throw new IllegalArgumentException("Expected #rrggbb but got: " + text);
        }
        int rgb = Integer.parseInt(hex, 16);
        return fromRgb(rgb);
    }

    public static RgbColor fromRgb(int rgb) {
        return new RgbColor((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
    }

    /** Packed 0xRRGGBB value as stored by TYPE_INT_RGB rasters. */
    public int toRgb() {
        return (red << 16) | (green << 8) | blue;
    }

    public String toHex() {
        return String.format(Locale.ROOT, "#%02x%02x%02x", red, green, blue);
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("RGB " + name + " must be between 0 and 255 (was " + value + ")");
        }
    }
}
