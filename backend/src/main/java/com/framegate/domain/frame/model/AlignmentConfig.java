package com.framegate.domain.frame.model;

/**
 * Resolved alignment settings for one run.
 *
 * @param method        contact patch (root zone centroid), bounding-box center, or none
 * @param verticalLock  whether the frame baseline is snapped to the anchor baseline
 * @param rootZoneRatio bottom fraction of the visible height used for the root centroid
 * @param maxShiftX     safety-valve bound on the horizontal correction, in pixels
 */
public record AlignmentConfig(
        AlignmentMethod method,
        boolean verticalLock,
        double rootZoneRatio,
        int maxShiftX
) {

    public static final double MIN_ROOT_ZONE_RATIO = 0.05;
    public static final double MAX_ROOT_ZONE_RATIO = 0.50;

    public static AlignmentConfig defaults() {
        return new AlignmentConfig(AlignmentMethod.CONTACT_PATCH, true, 0.15, 32);
    }
}
