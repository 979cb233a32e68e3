package com.project.image.bichrome;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.IndexColorModel;
import java.awt.image.WritableRaster;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;
import javax.imageio.ImageIO;

/** Synthetic images for tests. */
final class SampleImages {

    private SampleImages() {}

    /** 8-bit gray image whose pixels are exactly the given luminance values, row-major. */
    static BufferedImage gray(int width, int height, int... values) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = img.getRaster();
        for (int i = 0; i < values.length; i++) {
            raster.setSample(i % width, i / width, 0, values[i]);
        }
        return img;
    }

    /** Opaque gray+alpha image (PNG color type 4) with the given gray values, row-major. */
    static BufferedImage grayAlpha(int width, int height, int... values) {
        ComponentColorModel cm = new ComponentColorModel(ColorSpace.getInstance(ColorSpace.CS_GRAY),
                true, false, Transparency.TRANSLUCENT, DataBuffer.TYPE_BYTE);
        WritableRaster raster = cm.createCompatibleWritableRaster(width, height);
        for (int i = 0; i < values.length; i++) {
            raster.setSample(i % width, i / width, 0, values[i]);
            raster.setSample(i % width, i / width, 1, 255);
        }
        return new BufferedImage(cm, raster, false, null);
    }

    /** Palette image whose entries are the given gray levels; pixel i uses entry i. */
    static BufferedImage indexedGray(int width, int height, int... levels) {
        byte[] gray = new byte[levels.length];
        for (int i = 0; i < levels.length; i++) {
            gray[i] = (byte) levels[i];
        }
        IndexColorModel cm = new IndexColorModel(8, levels.length, gray, gray, gray);
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_INDEXED, cm);
        for (int i = 0; i < levels.length; i++) {
            img.getRaster().setSample(i % width, i / width, 0, i);
        }
        return img;
    }

    /** Dark background with a light square and a gradient strip, so both classes are present. */
    static BufferedImage scene(int width, int height) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(new Color(30, 40, 50)); g.fillRect(0, 0, width, height);
        g.setColor(new Color(220, 210, 190)); g.fillRect(width / 4, height / 4, width / 2, height / 2);
        for (int x = 0; x < width; x++) {
            g.setColor(new Color(x * 255 / Math.max(1, width - 1), 128, 64));
            g.drawLine(x, height - 4, x, height - 1);
        }
        g.dispose();
        return img;
    }

    /** Random salt-and-pepper pattern; compresses poorly, which makes size differences visible. */
    static BufferedImage noise(int width, int height, long seed) {
        Random random = new Random(seed);
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                img.setRGB(x, y, random.nextBoolean() ? 0xFFFFFF : 0x000000);
            }
        }
        return img;
    }

    static Path write(BufferedImage img, Path target, String format) throws IOException {
        if (!ImageIO.write(img, format, target.toFile())) {
            throw new IOException("No writer for " + format);
        }
        return target;
    }

    static byte[] png(BufferedImage img) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(img, "png", out);
        return out.toByteArray();
    }

    static Path corrupt(Path target) throws IOException {
        return Files.write(target, "definitely not an image".getBytes());
    }
}
