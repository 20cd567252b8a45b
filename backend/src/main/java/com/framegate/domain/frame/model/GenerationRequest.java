package com.framegate.domain.frame.model;

import java.util.List;

/**
 * Everything the external generator receives for one attempt.
 *
 * @param references     anchor first, then the previous approved frame when chaining applies
 * @param prompt         fully resolved prompt text
 * @param negativePrompt constraints the generator should avoid (nullable)
 * @param generationSize square resolution the generator should produce
 * @param seed           deterministic on the first attempt, random afterwards
 * @param loopClosure    last frame of a cyclic move, steered back toward the anchor pose
 */
public record GenerationRequest(
        String runId,
        int frameIndex,
        int attemptIndex,
        int totalFrames,
        List<ReferenceImage> references,
        String prompt,
        String negativePrompt,
        int generationSize,
        long seed,
        boolean loopClosure,
        RetryAction strategy
) {

    public boolean hasPreviousFrameReference() {
        return references.stream().anyMatch(r -> r.role() == ReferenceRole.PREVIOUS_FRAME);
    }
}
