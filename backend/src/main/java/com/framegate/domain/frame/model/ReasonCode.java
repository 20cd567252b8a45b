package com.framegate.domain.frame.model;

/**
 * Closed set of failure identifiers produced by normalization, auditing and generation.
 * <p>
 * Codes flagged {@code transientFailure} form the single failure class that is retried once
 * with a uniform strategy before terminal rejection.
 * </p>
 */
public enum ReasonCode {

    HF01_DIMENSION_MISMATCH(ReasonCategory.HARD_FAIL, false, "Frame dimensions differ from the target canvas"),
    HF02_FULLY_TRANSPARENT(ReasonCategory.HARD_FAIL, false, "Frame has no visible pixels"),
    HF03_IMAGE_CORRUPTED(ReasonCategory.HARD_FAIL, true, "Frame could not be decoded"),
    HF04_WRONG_COLOR_DEPTH(ReasonCategory.HARD_FAIL, false, "Frame is not 4-channel RGBA"),
    HF05_FILE_SIZE_INVALID(ReasonCategory.HARD_FAIL, false, "Encoded frame size outside sane bounds"),
    HF_IDENTITY_COLLAPSE(ReasonCategory.HARD_FAIL, false, "Identity still drifting after two re-anchors"),

    SF01_IDENTITY_DRIFT(ReasonCategory.SOFT_FAIL, false, "Structural similarity to the anchor below minimum"),
    SF02_PALETTE_DRIFT(ReasonCategory.SOFT_FAIL, false, "Too many pixels outside the allowed palette"),
    SF03_ALPHA_HALO(ReasonCategory.SOFT_FAIL, false, "Semi-transparent fringe on sprite edges"),
    SF04_BASELINE_DRIFT(ReasonCategory.SOFT_FAIL, false, "Residual baseline or root drift after alignment"),
    SF05_PIXEL_NOISE(ReasonCategory.SOFT_FAIL, false, "Isolated orphan pixels"),
    SF06_TEMPORAL_FLICKER(ReasonCategory.SOFT_FAIL, false, "Frame differs too much from the previous approved frame"),
    SF07_COMPOSITE_LOW(ReasonCategory.SOFT_FAIL, false, "Weighted composite score below minimum"),
    SF_FRINGE_RISK(ReasonCategory.SOFT_FAIL, false, "Chroma key colour bleeding into sprite edges"),

    SYS_GENERATOR_TRANSIENT(ReasonCategory.SYSTEM_ERROR, true, "Generator failed with a retryable error"),
    SYS_GENERATION_FAILED(ReasonCategory.SYSTEM_ERROR, false, "Generator failed with a non-retryable error");

    private final ReasonCategory category;
    private final boolean transientFailure;
    private final String description;

    ReasonCode(ReasonCategory category, boolean transientFailure, String description) {
        this.category = category;
        this.transientFailure = transientFailure;
        this.description = description;
    }

    public ReasonCategory getCategory() {
        return category;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }

    public String getDescription() {
        return description;
    }

    public boolean isSoft() {
        return category == ReasonCategory.SOFT_FAIL;
    }
}
