package com.framegate.domain.frame.model;

public record StopReason(
        StopCondition condition,
        double value,
        double threshold,
        String message
) {
}
