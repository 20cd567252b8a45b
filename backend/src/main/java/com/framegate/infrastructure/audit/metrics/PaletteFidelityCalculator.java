package com.framegate.infrastructure.audit.metrics;

import com.framegate.domain.frame.model.PixelBuffer;
import com.framegate.infrastructure.imaging.ColorMath;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Share of opaque pixels within a Euclidean RGB distance of the nearest allowed colour.
 */
@Component
public class PaletteFidelityCalculator {

    public static final double DEFAULT_TOLERANCE = 30.0;
    private static final int TOP_OFF_PALETTE = 10;

    public PaletteReport compute(PixelBuffer frame, List<Integer> palette, double tolerance) {
        if (palette == null || palette.isEmpty()) {
            throw new IllegalArgumentException("Palette must contain at least one colour");
        }

        Map<Integer, Boolean> verdictCache = new HashMap<>();
        Map<Integer, Integer> offPalette = new HashMap<>();
        int opaque = 0;
        int matched = 0;

        for (int y = 0; y < frame.height(); y++) {
            for (int x = 0; x < frame.width(); x++) {
                if (!frame.isOpaque(x, y)) {
                    continue;
                }
                opaque++;
                int rgb = PixelBuffer.rgb(frame.get(x, y));
                boolean inPalette = verdictCache.computeIfAbsent(rgb, c -> nearestDistance(c, palette) <= tolerance);
                if (inPalette) {
                    matched++;
                } else {
                    offPalette.merge(rgb, 1, Integer::sum);
                }
            }
        }

        List<String> top = offPalette.entrySet().stream()
                .sorted(Map.Entry.<Integer, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<Integer, Integer>comparingByKey()))
                .limit(TOP_OFF_PALETTE)
                .map(e -> ColorMath.toHex(e.getKey()))
                .toList();

        double fidelity = opaque == 0 ? 1.0 : (double) matched / opaque;
        return new PaletteReport(fidelity, opaque, matched, top);
    }

    /**
     * Distinct opaque colours of an image, most frequent first.
     */
    public List<Integer> extractPalette(PixelBuffer image, int maxColors) {
        Map<Integer, Integer> counts = new HashMap<>();
        for (int y = 0; y < image.height(); y++) {
            for (int x = 0; x < image.width(); x++) {
                if (image.isOpaque(x, y)) {
                    counts.merge(PixelBuffer.rgb(image.get(x, y)), 1, Integer::sum);
                }
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<Integer, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.<Integer, Integer>comparingByKey()))
                .limit(maxColors)
                .map(Map.Entry::getKey)
                .toList();
    }

    private double nearestDistance(int rgb, List<Integer> palette) {
        double best = Double.MAX_VALUE;
        for (int colour : palette) {
            best = Math.min(best, ColorMath.distance(rgb, colour));
            if (best == 0.0) {
                break;
            }
        }
        return best;
    }
}
