package com.framegate.domain.frame.model;

import java.time.Instant;
import java.util.List;

/**
 * One generation (or cleanup) attempt of a frame, as persisted in the run state.
 *
 * @param strategy      action that produced this attempt
 * @param decision      action the ladder chose after auditing this attempt
 * @param candidatePath normalized candidate written for this attempt (nullable)
 */
public record AttemptRecord(
        int attemptIndex,
        Instant timestamp,
        RetryAction strategy,
        Long seed,
        String promptHash,
        Double compositeScore,
        Double identityScore,
        List<ReasonCode> reasonCodes,
        RetryAction decision,
        String candidatePath
) {

    public boolean passed() {
        return reasonCodes.isEmpty();
    }

    public AttemptRecord withDecision(RetryAction decided) {
        return new AttemptRecord(attemptIndex, timestamp, strategy, seed, promptHash,
                compositeScore, identityScore, reasonCodes, decided, candidatePath);
    }
}
