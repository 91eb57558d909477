package com.tableadvisor.common.model;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * One decoded video frame: packed ARGB pixels in row-major order.
 *
 * <p>The pixel buffer is borrowed, not copied: the producer hands it over and must not
 * write to it afterwards, and readers must treat it as read-only. Equality compares
 * dimensions and pixel content.
 *
 * <p>The record does not validate its buffer; the detector treats a short or missing
 * buffer as a degenerate frame.
 */
public record Frame(int width, int height, int[] argb) {

    public static Frame of(int width, int height, int[] argb) {
        return new Frame(width, height, argb);
    }

    public static Frame fromImage(BufferedImage image) {
        if (image == null) return new Frame(0, 0, new int[0]);
        int w = image.getWidth();
        int h = image.getHeight();
        int[] pixels = image.getRGB(0, 0, w, h, null, 0, w);
        return new Frame(w, h, pixels);
    }

    public boolean isDegenerate() {
        return width <= 0 || height <= 0 || argb == null || argb.length < (long) width * height;
    }

    public int pixel(int x, int y) {
        return argb[y * width + x];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Frame other)) return false;
        return width == other.width && height == other.height && Arrays.equals(argb, other.argb);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(argb);
    }

    @Override
    public String toString() {
        return "Frame[" + width + "x" + height + ", pixels=" + (argb == null ? 0 : argb.length) + "]";
    }
}
