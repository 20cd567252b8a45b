package com.framegate.domain.frame.model;

public enum ReferenceRole {

    ANCHOR("[IMAGE 1]: MASTER ANCHOR (IDENTITY TRUTH)"),
    PREVIOUS_FRAME("[IMAGE 2]: PREVIOUS FRAME (POSE REFERENCE)");

    private final String label;

    ReferenceRole(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
