package com.framegate.infrastructure.imaging;

import com.framegate.domain.frame.model.PixelBuffer;
import com.framegate.domain.frame.model.ReasonCode;

/**
 * @param failure      set when the strategy cannot be applied (nullable)
 * @param removed      pixels keyed out
 * @param fringeRatio  share of remaining opaque pixels still close to the key colour
 */
public record TransparencyOutcome(PixelBuffer buffer, ReasonCode failure, int removed, double fringeRatio) {

    public static final double FRINGE_RISK_RATIO = 0.05;

    public static TransparencyOutcome failed(ReasonCode failure) {
        return new TransparencyOutcome(null, failure, 0, 0.0);
    }

    public boolean fringeRisk() {
        return fringeRatio > FRINGE_RISK_RATIO;
    }
}
