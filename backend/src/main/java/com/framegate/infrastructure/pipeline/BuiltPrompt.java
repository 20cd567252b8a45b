package com.framegate.infrastructure.pipeline;

/**
 * @param hash short SHA-256 of prompt and negative prompt, recorded on the attempt
 */
public record BuiltPrompt(String prompt, String negativePrompt, String hash) {
}
