package com.framegate.domain.frame.model;

public enum RunStatus {
    IN_PROGRESS,
    COMPLETED,
    STOPPED,
    FAILED
}
