package com.framegate.infrastructure.pipeline;

import com.framegate.domain.frame.model.ReleaseStatus;
import com.framegate.domain.frame.model.RunStatus;
import com.framegate.domain.frame.model.StopCondition;
import com.framegate.infrastructure.pipeline.DiagnosticReport.FailureTally;

import java.time.Instant;
import java.util.List;

/**
 * Written to {@code summary.json} whenever a run ends, whatever its final status.
 *
 * @param stopCondition set when the run stopped or failed (nullable)
 * @param export        set when an atlas was packed (nullable)
 */
public record RunSummaryReport(
        String runId,
        String moveId,
        Instant generatedAt,
        RunStatus finalStatus,
        StopCondition stopCondition,
        FrameCounts frames,
        Rates rates,
        AttemptStats attempts,
        List<FailureTally> topFailures,
        Timing timing,
        ExportSummary export
) {

    /**
     * @param attempted frames that reached a terminal status
     * @param pending   frames not yet approved or rejected
     */
    public record FrameCounts(int total, int attempted, int approved, int rejected, int pending) {
    }

    /**
     * Retry and reject rates are the run's stop-condition aggregates (fractions of scheduled frames).
     */
    public record Rates(double completionRate, double successRate, double retryRate, double rejectRate) {
    }

    public record AttemptStats(int total, double perFrameAverage, int minPerFrame, int maxPerFrame) {
    }

    public record Timing(Instant startedAt, Instant endedAt, long durationMs, long averagePerFrameMs) {
    }

    public record ExportSummary(String atlasPath, ReleaseStatus releaseStatus, boolean validationPassed,
                                boolean overrideUsed) {
    }
}
