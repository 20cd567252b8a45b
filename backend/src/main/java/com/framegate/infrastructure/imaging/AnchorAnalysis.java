package com.framegate.infrastructure.imaging;

import com.framegate.domain.frame.model.AlignmentTarget;

/**
 * Either an {@link AlignmentTarget} or an error code with a message.
 */
public record AnchorAnalysis(AlignmentTarget target, String errorCode, String message) {

    public static final String FULLY_TRANSPARENT = "ANCHOR_FULLY_TRANSPARENT";
    public static final String ROOT_ZONE_EMPTY = "ANCHOR_ROOT_ZONE_EMPTY";

    public static AnchorAnalysis success(AlignmentTarget target) {
        return new AnchorAnalysis(target, null, null);
    }

    public static AnchorAnalysis error(String errorCode, String message) {
        return new AnchorAnalysis(null, errorCode, message);
    }

    public boolean ok() {
        return target != null;
    }
}
