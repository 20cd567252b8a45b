package com.framegate.infrastructure.audit;

import com.framegate.infrastructure.audit.metrics.CompositeWeights;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolved auditor thresholds for one run.
 *
 * @param orphanWarn      orphan count above which a warning is recorded
 * @param orphanMax       orphan count above which the frame fails
 * @param mapdThresholds  temporal coherence limit per move type
 * @param mapdDefault     limit for move types missing from the table
 * @param mapdBypass      move types that skip temporal coherence
 */
public record AuditThresholds(
        double identityMin,
        double paletteMin,
        double paletteTolerance,
        double alphaArtifactMax,
        int baselineDriftMax,
        int orphanWarn,
        int orphanMax,
        double compositeMin,
        int minFileBytes,
        int maxFileBytes,
        CompositeWeights weights,
        Map<String, Double> mapdThresholds,
        double mapdDefault,
        Set<String> mapdBypass
) {

    public static AuditThresholds defaults() {
        return new AuditThresholds(0.85, 0.90, 30.0, 0.20, 1, 5, 15, 0.70,
                67, 5 * 1024 * 1024, CompositeWeights.defaults(),
                Map.of("idle", 0.02, "block", 0.05, "walk", 0.10, "run", 0.15),
                0.10, new TreeSet<>(Set.of("attack", "jump", "hit")));
    }

    public double mapdThresholdFor(String moveType) {
        return mapdThresholds.getOrDefault(normalize(moveType), mapdDefault);
    }

    public boolean bypassesTemporalCheck(String moveType) {
        return mapdBypass.contains(normalize(moveType));
    }

    private static String normalize(String moveType) {
        return moveType == null ? "" : moveType.trim().toLowerCase(Locale.ROOT);
    }
}
