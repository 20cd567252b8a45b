package com.framegate.domain.frame.model;

public enum ReleaseStatus {
    PENDING,
    RELEASE_READY,
    VALIDATION_FAILED
}
