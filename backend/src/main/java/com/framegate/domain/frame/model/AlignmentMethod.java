package com.framegate.domain.frame.model;

public enum AlignmentMethod {
    CONTACT_PATCH,
    CENTER,
    NONE
}
