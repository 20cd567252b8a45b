package com.framegate.infrastructure.audit.metrics;

import org.springframework.stereotype.Component;

/**
 * Weighted sum of the four composite components, each in [0, 1], normalised by the weight total.
 */
@Component
public class CompositeScorer {

    public double score(double stability, double identity, double palette, double style, CompositeWeights weights) {
        double total = weights.total();
        if (total <= 0) {
            throw new IllegalArgumentException("Composite weights must sum to a positive value");
        }
        double sum = weights.stability() * clamp(stability)
                + weights.identity() * clamp(identity)
                + weights.palette() * clamp(palette)
                + weights.style() * clamp(style);
        return sum / total;
    }

    /** Baseline stability: 1 at zero residual, 0 once the residual reaches the safety valve. */
    public double stability(int residual, int maxShiftX) {
        return 1.0 - Math.min(1.0, (double) residual / Math.max(1, maxShiftX));
    }

    public double style(int orphanCount, int orphanMax, double haloRatio) {
        double noise = 1.0 - Math.min(1.0, (double) orphanCount / Math.max(1, 2 * orphanMax));
        return noise * (1.0 - clamp(haloRatio));
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
