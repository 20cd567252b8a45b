package com.framegate.infrastructure.audit.metrics;

public record CompositeWeights(double stability, double identity, double palette, double style) {

    public static CompositeWeights defaults() {
        return new CompositeWeights(0.35, 0.30, 0.20, 0.15);
    }

    public double total() {
        return stability + identity + palette + style;
    }
}
