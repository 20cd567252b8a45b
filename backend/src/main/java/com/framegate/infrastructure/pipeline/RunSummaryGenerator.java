package com.framegate.infrastructure.pipeline;

import com.framegate.domain.frame.model.AttemptRecord;
import com.framegate.domain.frame.model.FrameState;
import com.framegate.domain.frame.model.FrameStatus;
import com.framegate.domain.frame.model.ReasonCode;
import com.framegate.domain.frame.model.ReleaseStatus;
import com.framegate.domain.frame.model.RunState;
import com.framegate.infrastructure.pipeline.DiagnosticReport.FailureTally;
import com.framegate.infrastructure.pipeline.RunSummaryReport.AttemptStats;
import com.framegate.infrastructure.pipeline.RunSummaryReport.ExportSummary;
import com.framegate.infrastructure.pipeline.RunSummaryReport.FrameCounts;
import com.framegate.infrastructure.pipeline.RunSummaryReport.Rates;
import com.framegate.infrastructure.pipeline.RunSummaryReport.Timing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.IntSummaryStatistics;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the end-of-run summary: frame counts, rates, attempt statistics, the most frequent
 * reason codes and timing.
 */
@Slf4j
@Component
public class RunSummaryGenerator {

    private static final int TOP_FAILURES = 3;
    private static final int EXAMPLE_FRAMES = 3;

    /**
     * @param atlasPath packed atlas, or null when the run was not exported
     */
    public RunSummaryReport generate(RunState state, Path atlasPath, Instant now) {
        int total = state.totalFrames();
        int approved = (int) state.countWithStatus(FrameStatus.APPROVED);
        int rejected = (int) state.countWithStatus(FrameStatus.REJECTED);
        int attempted = approved + rejected;
        FrameCounts frames = new FrameCounts(total, attempted, approved, rejected, total - attempted);

        Rates rates = new Rates(
                total == 0 ? 0.0 : (double) approved / total,
                attempted == 0 ? 0.0 : (double) approved / attempted,
                state.getRetryRate(),
                state.getRejectRate());

        IntSummaryStatistics perFrame = state.getFrames().stream()
                .mapToInt(FrameState::attemptCount)
                .filter(count -> count > 0)
                .summaryStatistics();
        int totalAttempts = (int) perFrame.getSum();
        AttemptStats attempts = perFrame.getCount() == 0
                ? new AttemptStats(0, 0.0, 0, 0)
                : new AttemptStats(totalAttempts, perFrame.getAverage(), perFrame.getMin(), perFrame.getMax());

        Instant startedAt = state.getStartedAt() != null ? state.getStartedAt() : now;
        long durationMs = Math.max(0, Duration.between(startedAt, now).toMillis());
        Timing timing = new Timing(startedAt, now, durationMs, attempted == 0 ? 0 : durationMs / attempted);

        ExportSummary export = atlasPath == null ? null
                : new ExportSummary(atlasPath.toString(), state.getReleaseStatus(),
                state.getReleaseStatus() == ReleaseStatus.RELEASE_READY && !state.isOverrideUsed(),
                state.isOverrideUsed());

        RunSummaryReport report = new RunSummaryReport(state.getRunId(), state.getMoveId(), now, state.getStatus(),
                state.getStopReason() == null ? null : state.getStopReason().condition(),
                frames, rates, attempts, tallyAttempts(state), timing, export);
        log.info("[Summary] Run {} {}: {}/{} approved, {} rejected, {} attempts",
                state.getRunId(), state.getStatus(), approved, total, rejected, totalAttempts);
        return report;
    }

    /**
     * Counts every reason code of every attempt, so a code repeated across retries weighs more.
     */
    List<FailureTally> tallyAttempts(RunState state) {
        Map<ReasonCode, Integer> counts = new EnumMap<>(ReasonCode.class);
        Map<ReasonCode, Set<Integer>> frames = new EnumMap<>(ReasonCode.class);
        for (FrameState frame : state.getFrames()) {
            for (AttemptRecord attempt : frame.getAttempts()) {
                for (ReasonCode code : attempt.reasonCodes()) {
                    counts.merge(code, 1, Integer::sum);
                    frames.computeIfAbsent(code, c -> new LinkedHashSet<>()).add(frame.getIndex());
                }
            }
        }
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        return counts.entrySet().stream()
                .sorted(Map.Entry.<ReasonCode, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<ReasonCode, Integer>comparingByKey()))
                .limit(TOP_FAILURES)
                .map(e -> new FailureTally(e.getKey(), e.getValue(), e.getValue() * 100.0 / total,
                        frames.get(e.getKey()).stream().limit(EXAMPLE_FRAMES).toList()))
                .toList();
    }
}
