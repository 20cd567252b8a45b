package com.framegate.domain.frame.model;

/**
 * Spatial reference extracted once from the anchor image.
 *
 * @param baselineY lowest opaque row
 * @param rootX     centroid of the opaque pixels in the root zone
 * @param topY      highest opaque row
 * @param centerX   bounding-box center, used by {@link AlignmentMethod#CENTER}
 */
public record AlignmentTarget(int baselineY, int rootX, int topY, int centerX) {

    public int visibleHeight() {
        return baselineY - topY;
    }
}
