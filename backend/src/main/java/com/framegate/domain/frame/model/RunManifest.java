package com.framegate.domain.frame.model;

import java.util.List;

/**
 * Resolved description of one animation run.
 *
 * @param moveType   tag selecting the temporal coherence threshold (idle, walk, attack, ...)
 * @param cyclic     whether the last frame loops back into the first
 * @param anchorPath identity reference image
 * @param palette    allowed colours as {@code #RRGGBB}; empty means derive from the anchor
 * @param thresholds optional auditor overrides (nullable)
 */
public record RunManifest(
        String runId,
        String characterId,
        String moveId,
        String moveType,
        int frameCount,
        boolean cyclic,
        String anchorPath,
        List<String> palette,
        ManifestThresholds thresholds
) {
}
