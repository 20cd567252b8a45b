package com.framegate.infrastructure.retry;

import com.framegate.domain.frame.model.PixelBuffer;
import com.framegate.infrastructure.imaging.ColorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic cleanup applied by the {@code POST_PROCESS} ladder step, without regenerating:
 * alpha snapping, orphan removal, palette snapping.
 */
@Slf4j
@Component
public class PostProcessor {

    public PixelBuffer cleanup(PixelBuffer frame, List<Integer> palette, double paletteTolerance) {
        PixelBuffer result = snapAlpha(frame);
        int orphans = removeOrphans(result);
        int snapped = snapToPalette(result, palette, paletteTolerance);
        log.info("[PostProcess] Removed {} orphan pixels, snapped {} off-palette pixels", orphans, snapped);
        return result;
    }

    PixelBuffer snapAlpha(PixelBuffer frame) {
        PixelBuffer result = frame.copy();
        for (int y = 0; y < result.height(); y++) {
            for (int x = 0; x < result.width(); x++) {
                int pixel = result.get(x, y);
                int alpha = PixelBuffer.alpha(pixel);
                if (alpha >= PixelBuffer.OPAQUE_THRESHOLD) {
                    result.set(x, y, (pixel & 0xFFFFFF00) | 0xFF);
                } else if (alpha > 0) {
                    result.set(x, y, 0);
                }
            }
        }
        return result;
    }

    int removeOrphans(PixelBuffer frame) {
        PixelBuffer source = frame.copy();
        int replaced = 0;
        for (int y = 1; y < source.height() - 1; y++) {
            for (int x = 1; x < source.width() - 1; x++) {
                if (!source.isOpaque(x, y)) {
                    continue;
                }
                int pixel = source.get(x, y);
                int[] neighbours = {
                        source.get(x, y - 1), source.get(x, y + 1), source.get(x - 1, y), source.get(x + 1, y)
                };
                boolean orphan = true;
                for (int n : neighbours) {
                    if (n == pixel) {
                        orphan = false;
                        break;
                    }
                }
                if (orphan) {
                    frame.set(x, y, mostCommon(neighbours));
                    replaced++;
                }
            }
        }
        return replaced;
    }

    int snapToPalette(PixelBuffer frame, List<Integer> palette, double tolerance) {
        if (palette.isEmpty()) {
            return 0;
        }
        int snapped = 0;
        for (int y = 0; y < frame.height(); y++) {
            for (int x = 0; x < frame.width(); x++) {
                if (!frame.isOpaque(x, y)) {
                    continue;
                }
                int rgb = PixelBuffer.rgb(frame.get(x, y));
                int nearest = palette.get(0);
                double best = Double.MAX_VALUE;
                for (int colour : palette) {
                    double d = ColorMath.distance(rgb, colour);
                    if (d < best) {
                        best = d;
                        nearest = colour;
                    }
                }
                if (best > tolerance) {
                    frame.set(x, y, (nearest << 8) | PixelBuffer.alpha(frame.get(x, y)));
                    snapped++;
                }
            }
        }
        return snapped;
    }

    private static int mostCommon(int[] values) {
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (int v : values) {
            counts.merge(v, 1, Integer::sum);
        }
        int best = values[0];
        int bestCount = 0;
        for (Map.Entry<Integer, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }
}
