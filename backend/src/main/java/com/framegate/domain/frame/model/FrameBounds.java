package com.framegate.domain.frame.model;

/**
 * Bounding box of the opaque pixels of a sprite, inclusive on all edges.
 */
public record FrameBounds(int topY, int bottomY, int leftX, int rightX) {

    public int visibleHeight() {
        return bottomY - topY;
    }

    public int centerX() {
        return (int) Math.round((leftX + rightX) / 2.0);
    }
}
