package com.framegate.domain.frame.model;

/**
 * @param chromaColor     key colour as {@code 0xRRGGBB}
 * @param chromaTolerance Euclidean RGB distance treated as background
 */
public record TransparencyConfig(TransparencyStrategy strategy, int chromaColor, double chromaTolerance) {

    public static final int DEFAULT_CHROMA = 0x00FF00;

    public static TransparencyConfig trueAlpha() {
        return new TransparencyConfig(TransparencyStrategy.TRUE_ALPHA, DEFAULT_CHROMA, 30);
    }
}
