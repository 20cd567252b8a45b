package com.framegate.infrastructure.pipeline;

/**
 * Run-level halt thresholds. Rates are fractions of the run's scheduled frames.
 */
public record StopConditions(
        double maxRetryRate,
        double maxRejectRate,
        int maxConsecutiveFails,
        int circuitBreakerLimit
) {

    public static StopConditions defaults() {
        return new StopConditions(0.50, 0.30, 5, 50);
    }
}
