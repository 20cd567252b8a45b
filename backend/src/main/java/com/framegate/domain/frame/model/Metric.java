package com.framegate.domain.frame.model;

public enum Metric {
    IDENTITY,
    PALETTE,
    ALPHA_HALO,
    BASELINE_DRIFT,
    ROOT_DRIFT,
    ALIGNMENT_RESIDUAL,
    ORPHAN_COUNT,
    MAPD,
    STABILITY,
    STYLE
}
