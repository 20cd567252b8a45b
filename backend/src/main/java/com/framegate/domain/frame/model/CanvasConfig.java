package com.framegate.domain.frame.model;

public record CanvasConfig(int generationSize, int targetSize) {

    public int scaleFactor() {
        return generationSize / targetSize;
    }
}
