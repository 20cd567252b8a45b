package com.framegate.domain.frame.service;

import com.framegate.domain.frame.exception.GenerationException;
import com.framegate.domain.frame.model.CandidateResult;
import com.framegate.domain.frame.model.GenerationRequest;

/**
 * External image generator.
 */
public interface GeneratorAdapter {

    /**
     * Generate one candidate frame.
     *
     * @param request anchor, optional previous frame, resolved prompt, resolution, seed, loop-closure flag
     * @return the raw candidate
     * @throws GenerationException classified as fail-fast, transient or rate-limited
     */
    CandidateResult generate(GenerationRequest request);

    /** Short identifier recorded in logs. */
    String name();
}
