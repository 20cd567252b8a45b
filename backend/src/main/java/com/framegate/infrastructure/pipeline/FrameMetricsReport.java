package com.framegate.infrastructure.pipeline;

import com.framegate.domain.frame.model.AuditResult;
import com.framegate.domain.frame.model.Metric;
import com.framegate.domain.frame.model.ReasonCode;
import com.framegate.domain.frame.model.RetryAction;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Written to {@code audit/frame_XXXX_metrics.json} after every audited attempt; the latest attempt
 * of a frame replaces the previous one.
 *
 * @param scores raw value of every metric the auditor computed; empty when a hard gate failed
 */
public record FrameMetricsReport(
        int frameIndex,
        int attemptIndex,
        RetryAction strategy,
        Instant computedAt,
        Map<Metric, Double> scores,
        double compositeScore,
        List<ReasonCode> reasonCodes,
        List<ReasonCode> warnings,
        int softMetricsComputed,
        boolean passed
) {

    public static FrameMetricsReport of(int frameIndex, int attemptIndex, RetryAction strategy,
                                        AuditResult audit, Instant now) {
        Map<Metric, Double> scores = new EnumMap<>(Metric.class);
        scores.putAll(audit.scores());
        return new FrameMetricsReport(frameIndex, attemptIndex, strategy, now, scores, audit.compositeScore(),
                List.copyOf(audit.reasonCodes()), List.copyOf(audit.warnings()), audit.softMetricsComputed(),
                audit.passed());
    }
}
