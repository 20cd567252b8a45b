package com.framegate.infrastructure.imaging;

import com.framegate.domain.frame.model.FrameBounds;

/**
 * Geometry of one sprite, measured relative to its own visible bounding box.
 */
public record FrameMeasurement(FrameBounds bounds, int rootX, int rootZoneHeight) {

    public int bottomY() {
        return bounds.bottomY();
    }
}
