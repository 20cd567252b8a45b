package com.framegate.infrastructure.retry;

import com.framegate.domain.frame.model.RetryAction;

import java.util.List;

/**
 * @param ladderOrder          enabled recovery actions in escalation order
 * @param maxAttemptsPerFrame  attempts (generation or cleanup) before a frame is rejected
 */
public record RetryPolicy(List<RetryAction> ladderOrder, int maxAttemptsPerFrame) {

    public static final List<RetryAction> DEFAULT_LADDER = List.of(
            RetryAction.REROLL_SEED,
            RetryAction.TIGHTEN_NEGATIVE,
            RetryAction.IDENTITY_RESCUE,
            RetryAction.POSE_RESCUE,
            RetryAction.POST_PROCESS,
            RetryAction.RE_ANCHOR);

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_LADDER, 5);
    }

    public boolean enabled(RetryAction action) {
        return ladderOrder.contains(action);
    }
}
