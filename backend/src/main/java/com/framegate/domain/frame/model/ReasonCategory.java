package com.framegate.domain.frame.model;

public enum ReasonCategory {
    /** Structural failure; rejects immediately. */
    HARD_FAIL,
    /** Quality threshold miss; drives the retry ladder. */
    SOFT_FAIL,
    /** I/O or external collaborator failure. */
    SYSTEM_ERROR
}
