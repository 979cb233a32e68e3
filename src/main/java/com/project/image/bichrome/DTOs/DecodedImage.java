package com.project.image.bichrome.DTOs;

import java.awt.image.BufferedImage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A decoded source image with what the encoder may carry over.
 *
 * @param image      pixels as decoded
 * @param formatName lowercase ImageIO format name, e.g. "png" or "jpeg"
 * @param textEntries keyword to value text metadata, in source order
 */
public record DecodedImage(BufferedImage image, String formatName, Map<String, String> textEntries) {

    public DecodedImage {
        textEntries = Collections.unmodifiableMap(new LinkedHashMap<>(textEntries));
    }

    public int width() { return image.getWidth(); }
    public int height() { return image.getHeight(); }
}
