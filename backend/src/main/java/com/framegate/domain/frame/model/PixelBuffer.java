package com.framegate.domain.frame.model;

import java.util.Arrays;

/**
 * Mutable RGBA raster, row-major, four bytes per pixel.
 * <p>
 * Packed pixel values use {@code 0xRRGGBBAA}. A pixel is <em>opaque</em> at alpha &gt;= 128
 * and <em>visible</em> at alpha &gt; 0.
 * </p>
 */
public final class PixelBuffer {

    public static final int OPAQUE_THRESHOLD = 128;

    private final int width;
    private final int height;
    private final byte[] rgba;

    public PixelBuffer(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Buffer dimensions must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.rgba = new byte[width * height * 4];
    }

    private PixelBuffer(int width, int height, byte[] rgba) {
        this.width = width;
        this.height = height;
        this.rgba = rgba;
    }

    public static PixelBuffer of(int width, int height, byte[] rgba) {
        if (rgba.length != width * height * 4) {
            throw new IllegalArgumentException("Expected " + (width * height * 4) + " bytes, got " + rgba.length);
        }
        return new PixelBuffer(width, height, rgba.clone());
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    public int get(int x, int y) {
        int i = offset(x, y);
        return ((rgba[i] & 0xFF) << 24)
                | ((rgba[i + 1] & 0xFF) << 16)
                | ((rgba[i + 2] & 0xFF) << 8)
                | (rgba[i + 3] & 0xFF);
    }

    public void set(int x, int y, int packedRgba) {
        int i = offset(x, y);
        rgba[i] = (byte) (packedRgba >>> 24);
        rgba[i + 1] = (byte) (packedRgba >>> 16);
        rgba[i + 2] = (byte) (packedRgba >>> 8);
        rgba[i + 3] = (byte) packedRgba;
    }

    public void set(int x, int y, int r, int g, int b, int a) {
        set(x, y, pack(r, g, b, a));
    }

    public int red(int x, int y) {
        return rgba[offset(x, y)] & 0xFF;
    }

    public int green(int x, int y) {
        return rgba[offset(x, y) + 1] & 0xFF;
    }

    public int blue(int x, int y) {
        return rgba[offset(x, y) + 2] & 0xFF;
    }

    public int alpha(int x, int y) {
        return rgba[offset(x, y) + 3] & 0xFF;
    }

    public boolean isOpaque(int x, int y) {
        return alpha(x, y) >= OPAQUE_THRESHOLD;
    }

    public boolean isVisible(int x, int y) {
        return alpha(x, y) > 0;
    }

    public boolean isFullyTransparent() {
        for (int i = 3; i < rgba.length; i += 4) {
            if (rgba[i] != 0) {
                return false;
            }
        }
        return true;
    }

    public PixelBuffer copy() {
        return new PixelBuffer(width, height, rgba.clone());
    }

    public byte[] toByteArray() {
        return rgba.clone();
    }

    public boolean sameSize(PixelBuffer other) {
        return other != null && other.width == width && other.height == height;
    }

    // ===== packed value helpers =====

    public static int pack(int r, int g, int b, int a) {
        return ((r & 0xFF) << 24) | ((g & 0xFF) << 16) | ((b & 0xFF) << 8) | (a & 0xFF);
    }

    public static int red(int packed) {
        return (packed >>> 24) & 0xFF;
    }

    public static int green(int packed) {
        return (packed >>> 16) & 0xFF;
    }

    public static int blue(int packed) {
        return (packed >>> 8) & 0xFF;
    }

    public static int alpha(int packed) {
        return packed & 0xFF;
    }

    /** Drops alpha: {@code 0xRRGGBB}. */
    public static int rgb(int packed) {
        return packed >>> 8;
    }

    private int offset(int x, int y) {
        if (!contains(x, y)) {
            throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") outside " + width + "x" + height);
        }
        return (y * width + x) * 4;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelBuffer other)) return false;
        return width == other.width && height == other.height && Arrays.equals(rgba, other.rgba);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(rgba);
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + width + "x" + height + "]";
    }
}
