package com.framegate.domain.frame.model;

public enum StopCondition {
    CIRCUIT_BREAKER,
    CONSECUTIVE_FAILS,
    REJECT_RATE,
    RETRY_RATE,
    USER_INTERRUPT,
    SYSTEM_ERROR
}
