package com.framegate.domain.frame.exception;

import java.time.Duration;

public class GenerationException extends RuntimeException {

    private final GenerationFailure failure;
    private final Duration retryAfter;

    public GenerationException(GenerationFailure failure, String message) {
        this(failure, message, null, null);
    }

    public GenerationException(GenerationFailure failure, String message, Throwable cause) {
        this(failure, message, null, cause);
    }

    public GenerationException(GenerationFailure failure, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.failure = failure;
        this.retryAfter = retryAfter;
    }

    public static GenerationException rateLimited(String message, Duration retryAfter) {
        return new GenerationException(GenerationFailure.RATE_LIMITED, message, retryAfter, null);
    }

    public GenerationFailure getFailure() {
        return failure;
    }

    /** Back-off hint reported by the adapter; null when none was given. */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
