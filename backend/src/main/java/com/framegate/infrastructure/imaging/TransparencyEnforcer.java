package com.framegate.infrastructure.imaging;

import com.framegate.domain.frame.model.PixelBuffer;
import com.framegate.domain.frame.model.ReasonCode;
import com.framegate.domain.frame.model.TransparencyConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class TransparencyEnforcer {

    static final double FRINGE_TOLERANCE = 50.0;

    public TransparencyOutcome enforce(DecodedImage decoded, TransparencyConfig config) {
        return switch (config.strategy()) {
            case TRUE_ALPHA -> requireAlpha(decoded);
            case CHROMA_KEY -> keyOut(decoded.pixels(), config);
        };
    }

    private TransparencyOutcome requireAlpha(DecodedImage decoded) {
        if (!decoded.hasAlpha()) {
            log.warn("[Transparency] true-alpha strategy but candidate has {} channels and no alpha", decoded.channels());
            return TransparencyOutcome.failed(ReasonCode.HF04_WRONG_COLOR_DEPTH);
        }
        return new TransparencyOutcome(decoded.pixels(), null, 0, 0.0);
    }

    private TransparencyOutcome keyOut(PixelBuffer source, TransparencyConfig config) {
        PixelBuffer result = source.copy();
        int chroma = config.chromaColor();
        int removed = 0;
        int opaque = 0;
        int fringe = 0;

        for (int y = 0; y < result.height(); y++) {
            for (int x = 0; x < result.width(); x++) {
                int pixel = result.get(x, y);
                double distance = ColorMath.distance(PixelBuffer.rgb(pixel), chroma);
                if (distance <= config.chromaTolerance()) {
                    result.set(x, y, 0);
                    removed++;
                } else if (PixelBuffer.alpha(pixel) >= PixelBuffer.OPAQUE_THRESHOLD) {
                    opaque++;
                    if (distance <= FRINGE_TOLERANCE) {
                        fringe++;
                    }
                }
            }
        }

        double fringeRatio = opaque == 0 ? 0.0 : (double) fringe / opaque;
        if (fringeRatio > TransparencyOutcome.FRINGE_RISK_RATIO) {
            log.warn("[Transparency] Fringe risk: {}% of opaque pixels near chroma #{}",
                    String.format("%.1f", fringeRatio * 100), String.format("%06X", chroma));
        }
        return new TransparencyOutcome(result, null, removed, fringeRatio);
    }
}
