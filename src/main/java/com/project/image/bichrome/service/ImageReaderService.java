package com.project.image.bichrome.service;

import com.project.image.bichrome.DTOs.DecodedImage;
import com.project.image.bichrome.exceptions.ImageDecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.w3c.dom.NodeList;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataFormatImpl;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageInputStream;

/**
 * Decodes source files with ImageIO. The reader and its stream live only for the
 * duration of one call.
 */
@Service
public class ImageReaderService {
    private static final Logger log = LoggerFactory.getLogger(ImageReaderService.class);

    public DecodedImage read(Path source) {
        String name = String.valueOf(source.getFileName());
        if (!Files.isRegularFile(source)) {
            throw new ImageDecodeException("Not a readable file: " + source);
        }

        try (ImageInputStream in = ImageIO.createImageInputStream(source.toFile())) {
            if (in == null) {
                throw new ImageDecodeException("Cannot open " + name);
            }
            ImageReader reader = findReader(in, name);
            try {
                reader.setInput(in, false, false);
                Map<String, String> text = readTextEntries(reader, name);
                BufferedImage image = reader.read(0);
                String format = reader.getFormatName().toLowerCase(Locale.ROOT);
                log.debug("Decoded {} as {} {}x{} (type {})",
                        name, format, image.getWidth(), image.getHeight(), image.getType());
                return new DecodedImage(image, format, text);
            } catch (RuntimeException e) {
                // some plugins fail with unchecked exceptions on truncated data
                throw new ImageDecodeException(name + " is corrupt: " + e.getMessage(), e);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new ImageDecodeException("Failed to decode " + name + ": " + e.getMessage(), e);
        }
    }

    private ImageReader findReader(ImageInputStream in, String name) {
        Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
        if (!readers.hasNext()) {
            throw new ImageDecodeException(name + " is not a supported image");
        }
        return readers.next();
    }

    private Map<String, String> readTextEntries(ImageReader reader, String name) {
        Map<String, String> entries = new LinkedHashMap<>();
        try {
            IIOMetadata metadata = reader.getImageMetadata(0);
            if (metadata == null || !metadata.isStandardMetadataFormatSupported()) {
                return entries;
            }
            IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(IIOMetadataFormatImpl.standardMetadataFormatName);
            NodeList textNodes = root.getElementsByTagName("TextEntry");
            for (int i = 0; i < textNodes.getLength(); i++) {
                IIOMetadataNode entry = (IIOMetadataNode) textNodes.item(i);
                String keyword = entry.getAttribute("keyword");
                String value = entry.getAttribute("value");
                if (keyword == null || keyword.isEmpty() || value == null) continue;
                entries.merge(keyword, value, (a, b) -> a + "\n" + b);
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Ignoring unreadable metadata in {}: {}", name, e.getMessage());
        }
        return entries;
    }
}
