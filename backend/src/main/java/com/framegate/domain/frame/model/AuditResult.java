package com.framegate.domain.frame.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Verdict of the quality auditor for one normalized frame.
 *
 * @param reasonCodes         every triggered failure in evaluation order, hard gates first
 * @param warnings            non-failing findings (orphan warn band, fringe risk)
 * @param scores              per-metric values; empty when a hard gate failed
 * @param compositeScore      weighted composite, 0 when a hard gate failed
 * @param softMetricsComputed number of soft metrics evaluated for this frame
 */
public record AuditResult(
        List<ReasonCode> reasonCodes,
        List<ReasonCode> warnings,
        Map<Metric, Double> scores,
        double compositeScore,
        int softMetricsComputed
) {

    public static AuditResult hardFail(ReasonCode code) {
        return new AuditResult(List.of(code), List.of(), new EnumMap<>(Metric.class), 0.0, 0);
    }

    public boolean passed() {
        return reasonCodes.isEmpty();
    }

    public boolean hasHardFailure() {
        return reasonCodes.stream().anyMatch(code -> !code.isSoft());
    }

    public Double score(Metric metric) {
        return scores.get(metric);
    }
}
