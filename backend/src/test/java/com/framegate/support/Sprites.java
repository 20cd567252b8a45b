package com.framegate.support;

import com.framegate.domain.frame.model.PixelBuffer;

/**
 * Synthetic sprites for imaging and audit tests.
 */
public final class Sprites {

    public static final int BODY = PixelBuffer.pack(200, 60, 40, 255);
    public static final int OUTLINE = PixelBuffer.pack(20, 20, 20, 255);

    private Sprites() {
    }

    public static PixelBuffer canvas(int size) {
        return new PixelBuffer(size, size);
    }

    /** Opaque rectangle, inclusive on all edges. */
    public static PixelBuffer rect(int size, int left, int top, int right, int bottom, int color) {
        PixelBuffer buffer = canvas(size);
        fill(buffer, left, top, right, bottom, color);
        return buffer;
    }

    /**
     * Body column whose root-zone centroid is {@code rootX} and whose lowest row is {@code bottomY}.
     */
    public static PixelBuffer body(int size, int rootX, int bottomY, int height) {
        return rect(size, rootX - 4, bottomY - height, rootX + 4, bottomY, BODY);
    }

    public static void fill(PixelBuffer buffer, int left, int top, int right, int bottom, int color) {
        for (int y = top; y <= bottom; y++) {
            for (int x = left; x <= right; x++) {
                buffer.set(x, y, color);
            }
        }
    }
}
