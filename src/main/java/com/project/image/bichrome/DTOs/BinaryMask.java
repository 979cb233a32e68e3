package com.project.image.bichrome.DTOs;

import java.util.Arrays;

/**
 * Row-major light/dark classification, one cell per source pixel.
 * The cell array is copied in and out, so a mask never changes after construction.
 */
public record BinaryMask(int width, int height, boolean[] light) {

    public BinaryMask {
        if (light.length != width * height) {
            throw new IllegalArgumentException("Mask size " + light.length + " does not match " + width + "x" + height);
        }
        light = light.clone();
    }

    @Override
    public boolean[] light() {
        return light.clone();
    }

    public int lightCount() {
        int count = 0;
        for (boolean cell : light) {
            if (cell) count++;
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BinaryMask other
                && width == other.width
                && height == other.height
                && Arrays.equals(light, other.light);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(light);
    }

    @Override
    public String toString() {
        return "BinaryMask[" + width + "x" + height + ", light=" + lightCount() + "]";
    }
}
