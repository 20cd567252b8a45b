package com.framegate.domain.frame.model;

/**
 * Per-manifest auditor overrides. Null fields keep the configured default.
 */
public record ManifestThresholds(
        Double identityMin,
        Double paletteMin,
        Double alphaArtifactMax,
        Double baselineDriftMax,
        Double compositeMin
) {
}
