package com.framegate.infrastructure.audit.metrics;

import com.framegate.domain.frame.model.PixelBuffer;
import org.springframework.stereotype.Component;

/**
 * Masked mean absolute pixel difference between consecutive frames, over the pixels visible in
 * both, normalised to [0, 1].
 */
@Component
public class MapdCalculator {

    public double compute(PixelBuffer current, PixelBuffer previous) {
        if (!current.sameSize(previous)) {
            throw new IllegalArgumentException("MAPD needs equal sizes: " + current + " vs " + previous);
        }
        long diff = 0;
        long count = 0;
        for (int y = 0; y < current.height(); y++) {
            for (int x = 0; x < current.width(); x++) {
                if (!current.isVisible(x, y) || !previous.isVisible(x, y)) {
                    continue;
                }
                int a = current.get(x, y);
                int b = previous.get(x, y);
                diff += Math.abs(PixelBuffer.red(a) - PixelBuffer.red(b))
                        + Math.abs(PixelBuffer.green(a) - PixelBuffer.green(b))
                        + Math.abs(PixelBuffer.blue(a) - PixelBuffer.blue(b));
                count++;
            }
        }
        return count == 0 ? 0.0 : (double) diff / (count * 3 * 255);
    }
}
