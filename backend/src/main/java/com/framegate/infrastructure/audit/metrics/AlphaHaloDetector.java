package com.framegate.infrastructure.audit.metrics;

import com.framegate.domain.frame.model.PixelBuffer;
import org.springframework.stereotype.Component;

/**
 * Edge pixels are opaque pixels touching a fully transparent 4-neighbour (the canvas border
 * counts as transparent). A halo pixel is an edge pixel with alpha below 254.
 */
@Component
public class AlphaHaloDetector {

    static final int SOLID_ALPHA = 254;
    private static final int[][] NEIGHBOURS = {{0, -1}, {0, 1}, {-1, 0}, {1, 0}};

    public HaloReport compute(PixelBuffer frame) {
        int edges = 0;
        int halo = 0;
        for (int y = 0; y < frame.height(); y++) {
            for (int x = 0; x < frame.width(); x++) {
                if (!frame.isOpaque(x, y) || !touchesTransparency(frame, x, y)) {
                    continue;
                }
                edges++;
                if (frame.alpha(x, y) < SOLID_ALPHA) {
                    halo++;
                }
            }
        }
        return new HaloReport(edges, halo, edges == 0 ? 0.0 : (double) halo / edges);
    }

    private boolean touchesTransparency(PixelBuffer frame, int x, int y) {
        for (int[] d : NEIGHBOURS) {
            int nx = x + d[0];
            int ny = y + d[1];
            if (!frame.contains(nx, ny) || frame.alpha(nx, ny) == 0) {
                return true;
            }
        }
        return false;
    }
}
