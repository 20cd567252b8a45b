package com.framegate.infrastructure.pipeline;

import com.framegate.domain.frame.model.FrameStatus;
import com.framegate.domain.frame.model.ReasonCode;
import com.framegate.domain.frame.model.RetryAction;
import com.framegate.domain.frame.model.StopCondition;

import java.time.Instant;
import java.util.List;

/**
 * Written to {@code diagnostic.json} when a run stops or fails.
 */
public record DiagnosticReport(
        String runId,
        Instant generatedAt,
        StopSummary stopCondition,
        RunSummary summary,
        List<FrameBreakdown> frameBreakdown,
        List<FailureTally> topFailures,
        RootCause rootCause,
        List<RecoveryAction> recoveryActions
) {

    public record StopSummary(StopCondition type, double threshold, double actualValue, String message) {
    }

    public record RunSummary(
            int totalFrames,
            int framesAttempted,
            int framesApproved,
            int framesRejected,
            int totalAttempts,
            double averageAttemptsPerFrame
    ) {
    }

    public record FrameBreakdown(
            int frameIndex,
            FrameStatus finalStatus,
            int attemptCount,
            List<ReasonCode> reasonCodes,
            List<Double> compositeScores,
            List<RetryAction> actionsTried
    ) {
    }

    /**
     * @param percentage    share of all recorded reason codes, 0-100
     * @param exampleFrames up to three frames where the code occurred
     */
    public record FailureTally(ReasonCode code, int count, double percentage, List<Integer> exampleFrames) {
    }

    public record RootCause(String suggestion, Confidence confidence, List<String> contributingFactors) {
    }

    public record RecoveryAction(String action, String description, int priority) {
    }

    public enum Confidence {
        HIGH, MEDIUM, LOW
    }
}
