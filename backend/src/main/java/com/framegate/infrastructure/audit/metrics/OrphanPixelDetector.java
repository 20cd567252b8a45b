package com.framegate.infrastructure.audit.metrics;

import com.framegate.domain.frame.model.PixelBuffer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Counts isolated opaque pixels: interior pixels (1px border excluded) whose four orthogonal
 * neighbours all differ from them in exact RGBA.
 */
@Component
public class OrphanPixelDetector {

    static final int MAX_LOCATIONS = 50;

    public OrphanReport compute(PixelBuffer frame) {
        int count = 0;
        List<int[]> locations = new ArrayList<>();

        for (int y = 1; y < frame.height() - 1; y++) {
            for (int x = 1; x < frame.width() - 1; x++) {
                if (!frame.isOpaque(x, y)) {
                    continue;
                }
                int pixel = frame.get(x, y);
                boolean hasTwin = frame.get(x, y - 1) == pixel
                        || frame.get(x, y + 1) == pixel
                        || frame.get(x - 1, y) == pixel
                        || frame.get(x + 1, y) == pixel;
                if (!hasTwin) {
                    count++;
                    if (locations.size() < MAX_LOCATIONS) {
                        locations.add(new int[]{x, y});
                    }
                }
            }
        }
        return new OrphanReport(count, locations);
    }
}
