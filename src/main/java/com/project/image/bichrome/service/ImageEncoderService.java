package com.project.image.bichrome.service;

import com.project.image.bichrome.exceptions.ImageEncodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataFormatImpl;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageOutputStream;

/**
 * Writes the final image in the format implied by the destination extension.
 * <p>
 * Standard output keeps the writer defaults (JPEG at {@code app.bichrome.standard-quality})
 * and carries the source text metadata. Cleanup output drops all source metadata, writes
 * JPEG at {@code app.bichrome.cleanup-quality} and PNG at maximum deflate compression.
 */
@Service
public class ImageEncoderService {
    private static final Logger log = LoggerFactory.getLogger(ImageEncoderService.class);

    private final float standardQuality;
    private final float cleanupQuality;

    public ImageEncoderService(@Value("${app.bichrome.standard-quality:0.95}") float standardQuality,
                               @Value("${app.bichrome.cleanup-quality:0.85}") float cleanupQuality) {
        if (cleanupQuality > standardQuality) {
            throw new IllegalArgumentException("Cleanup quality " + cleanupQuality
                    + " must not exceed standard quality " + standardQuality);
        }
        this.standardQuality = standardQuality;
        this.cleanupQuality = cleanupQuality;
    }

    public long write(BufferedImage image, Path destination, boolean cleanup, Map<String, String> textEntries) {
        String suffix = extensionOf(destination);
        ImageWriter writer = findWriter(suffix, destination);

        Path parent = destination.toAbsolutePath().getParent();
        if (parent == null || !Files.isDirectory(parent)) {
            writer.dispose();
            throw new ImageEncodeException("Output directory does not exist: " + parent);
        }

        try (OutputStream out = Files.newOutputStream(destination);
             ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            ImageWriteParam param = writeParam(writer, suffix, cleanup);
            IIOMetadata metadata = cleanup ? null : metadataWithText(writer, image, param, textEntries, destination);

            writer.setOutput(ios);
            writer.write(null, new IIOImage(image, null, metadata), param);
            ios.flush();
        } catch (IOException e) {
            throw new ImageEncodeException("Cannot write " + destination + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new ImageEncodeException("Encoding " + destination.getFileName() + " failed: " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }

        long size = sizeOf(destination);
        log.debug("Wrote {} ({} bytes, cleanup={})", destination, size, cleanup);
        return size;
    }

    private ImageWriteParam writeParam(ImageWriter writer, String suffix, boolean cleanup) {
        ImageWriteParam param = writer.getDefaultWriteParam();
        if (!param.canWriteCompressed()) {
            return param;
        }
        if (isJpeg(suffix)) {
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(cleanup ? cleanupQuality : standardQuality);
        } else if (cleanup && "png".equals(suffix)) {
            // 0.0 selects the strongest deflate level; PNG stays lossless
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(0.0f);
        }
        return param;
    }

    private IIOMetadata metadataWithText(ImageWriter writer, BufferedImage image, ImageWriteParam param,
                                         Map<String, String> textEntries, Path destination) {
        if (textEntries.isEmpty()) {
            return null;
        }
        IIOMetadata metadata = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(image), param);
        if (metadata == null || metadata.isReadOnly() || !metadata.isStandardMetadataFormatSupported()) {
            log.debug("{} cannot carry text metadata", destination.getFileName());
            return null;
        }

        IIOMetadataNode text = new IIOMetadataNode("Text");
        textEntries.forEach((keyword, value) -> {
            IIOMetadataNode entry = new IIOMetadataNode("TextEntry");
            entry.setAttribute("keyword", keyword);
            entry.setAttribute("value", value);
            text.appendChild(entry);
        });
        IIOMetadataNode root = new IIOMetadataNode(IIOMetadataFormatImpl.standardMetadataFormatName);
        root.appendChild(text);

        try {
            metadata.mergeTree(IIOMetadataFormatImpl.standardMetadataFormatName, root);
        } catch (IIOInvalidTreeException e) {
            log.warn("{} cannot carry text metadata, writing without it: {}", destination.getFileName(), e.getMessage());
            return null;
        }
        return metadata;
    }

    /** Lowercase extension without the dot. */
    public static String extensionOf(Path path) {
        String name = String.valueOf(path.getFileName());
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static boolean isJpeg(String suffix) {
        return "jpg".equals(suffix) || "jpeg".equals(suffix);
    }

    private static ImageWriter findWriter(String suffix, Path destination) {
        Iterator<ImageWriter> writers = suffix.isEmpty()
                ? Collections.<ImageWriter>emptyIterator()
                : ImageIO.getImageWritersBySuffix(suffix);
        if (!writers.hasNext()) {
            throw new ImageEncodeException("Unsupported output format for " + destination.getFileName());
        }
        return writers.next();
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new ImageEncodeException("Cannot stat written file " + file, e);
        }
    }
}
