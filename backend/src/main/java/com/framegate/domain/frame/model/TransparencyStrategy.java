package com.framegate.domain.frame.model;

public enum TransparencyStrategy {
    /** Generator output already carries an alpha channel. */
    TRUE_ALPHA,
    /** Background is a solid key colour that is removed after generation. */
    CHROMA_KEY
}
