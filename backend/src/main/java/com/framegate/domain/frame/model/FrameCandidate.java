package com.framegate.domain.frame.model;

/**
 * Generator output tagged with its place in the run.
 */
public record FrameCandidate(
        int frameIndex,
        int attemptIndex,
        byte[] imageData,
        Long seed,
        String promptHash
) {
}
