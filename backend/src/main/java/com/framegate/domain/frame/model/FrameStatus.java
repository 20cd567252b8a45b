package com.framegate.domain.frame.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-frame lifecycle. The only backward edge is the retry edge
 * {@code RETRY_DECIDING -> GENERATING}; {@link #APPROVED} and {@link #REJECTED} are terminal.
 */
public enum FrameStatus {
    PENDING,
    GENERATING,
    NORMALIZING,
    AUDITING,
    RETRY_DECIDING,
    APPROVED,
    REJECTED;

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED;
    }

    public boolean canTransitionTo(FrameStatus next) {
        return allowedNext().contains(next);
    }

    private Set<FrameStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(GENERATING);
            case GENERATING -> EnumSet.of(NORMALIZING, RETRY_DECIDING);
            case NORMALIZING -> EnumSet.of(AUDITING);
            case AUDITING -> EnumSet.of(RETRY_DECIDING);
            case RETRY_DECIDING -> EnumSet.of(GENERATING, AUDITING, APPROVED, REJECTED);
            case APPROVED, REJECTED -> EnumSet.noneOf(FrameStatus.class);
        };
    }
}
