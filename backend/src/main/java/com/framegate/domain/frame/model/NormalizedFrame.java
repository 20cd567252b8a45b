package com.framegate.domain.frame.model;

import java.util.List;

/**
 * Canvas-exact frame ready for auditing.
 *
 * @param pixels          buffer at target resolution
 * @param encoded         PNG encoding of {@code pixels}
 * @param alignment       shift metadata from the alignment step (nullable when decoding failed)
 * @param upstreamFailure failure raised before auditing, reported as the first hard gate (nullable)
 * @param warnings        non-blocking findings from normalization
 */
public record NormalizedFrame(
        int frameIndex,
        int attemptIndex,
        PixelBuffer pixels,
        byte[] encoded,
        AlignmentResult alignment,
        ReasonCode upstreamFailure,
        List<ReasonCode> warnings
) {

    public static NormalizedFrame failed(int frameIndex, int attemptIndex, ReasonCode failure) {
        return new NormalizedFrame(frameIndex, attemptIndex, null, new byte[0], null, failure, List.of());
    }

    public boolean wasClamped() {
        return alignment != null && alignment.clamped();
    }
}
