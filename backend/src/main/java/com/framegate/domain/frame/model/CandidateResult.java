package com.framegate.domain.frame.model;

/**
 * Raw generator output.
 *
 * @param imageData      encoded image bytes as returned by the generator
 * @param seed           seed the generator reports having used (nullable)
 * @param resolvedPrompt prompt text after any generator-side rewriting
 */
public record CandidateResult(byte[] imageData, Long seed, String resolvedPrompt) {
}
