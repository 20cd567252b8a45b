package com.framegate.domain.frame.model;

public enum AtlasAssertion {
    NAMING_CONVENTION,
    PIVOT_CONSISTENCY,
    BASELINE_STABILITY
}
