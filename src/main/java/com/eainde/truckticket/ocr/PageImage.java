package com.eainde.truckticket.ocr;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Grayscale raster of a page or of a logo template, luminance 0..255 stored row-major.
 */
public final class PageImage {

    private final int width;
    private final int height;
    private final float[] luminance;

    public PageImage(int width, int height, float[] luminance) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image must not be empty: " + width + "x" + height);
        }
        Objects.requireNonNull(luminance, "luminance");
        if (luminance.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " pixels, got " + luminance.length);
        }
        this.width = width;
        this.height = height;
        this.luminance = luminance;
    }

    public static PageImage fromBufferedImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        float[] px = new float[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int rgb = image.getRGB(x, y);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                px[y * w + x] = 0.299f * r + 0.587f * g + 0.114f * b;
            }
        }
        return new PageImage(w, h, px);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public float at(int x, int y) {
        return luminance[y * width + x];
    }

    /**
     * Crops a normalized region. The result is at least one pixel in each dimension.
     */
    public PageImage crop(BoundingBox region) {
        int x0 = (int) Math.floor(region.x0() * width);
        int y0 = (int) Math.floor(region.y0() * height);
        int x1 = Math.max(x0 + 1, (int) Math.ceil(region.x1() * width));
        int y1 = Math.max(y0 + 1, (int) Math.ceil(region.y1() * height));
        x1 = Math.min(x1, width);
        y1 = Math.min(y1, height);
        x0 = Math.min(x0, x1 - 1);
        y0 = Math.min(y0, y1 - 1);
        int w = x1 - x0;
        int h = y1 - y0;
        float[] px = new float[w * h];
        for (int y = 0; y < h; y++) {
            System.arraycopy(luminance, (y0 + y) * width + x0, px, y * w, w);
        }
        return new PageImage(w, h, px);
    }
}
