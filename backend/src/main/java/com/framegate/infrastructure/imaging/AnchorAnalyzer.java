package com.framegate.infrastructure.imaging;

import com.framegate.domain.frame.model.AlignmentTarget;
import com.framegate.domain.frame.model.FrameBounds;
import com.framegate.domain.frame.model.PixelBuffer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Extracts the baseline row and root-zone centroid of a sprite.
 * <p>
 * The same measurement runs on the anchor (once per run) and on every candidate frame, so
 * alignment compares like with like. The root zone is sized from the sprite's visible height,
 * never from the canvas height.
 * </p>
 */
@Slf4j
@Component
public class AnchorAnalyzer {

    public AnchorAnalysis analyze(PixelBuffer anchor, double rootZoneRatio) {
        Optional<FrameBounds> bounds = findBounds(anchor);
        if (bounds.isEmpty()) {
            return AnchorAnalysis.error(AnchorAnalysis.FULLY_TRANSPARENT,
                    "Anchor has no pixels with alpha >= " + PixelBuffer.OPAQUE_THRESHOLD);
        }

        Optional<FrameMeasurement> measurement = measureWithin(anchor, bounds.get(), rootZoneRatio);
        if (measurement.isEmpty()) {
            return AnchorAnalysis.error(AnchorAnalysis.ROOT_ZONE_EMPTY,
                    "Anchor root zone contains no opaque pixels");
        }

        FrameMeasurement m = measurement.get();
        AlignmentTarget target = new AlignmentTarget(
                m.bounds().bottomY(), m.rootX(), m.bounds().topY(), m.bounds().centerX());
        log.info("[Anchor] baselineY={}, rootX={}, visibleHeight={}, rootZoneHeight={}",
                target.baselineY(), target.rootX(), target.visibleHeight(), m.rootZoneHeight());
        return AnchorAnalysis.success(target);
    }

    /**
     * Measure a candidate frame. Empty when the frame has no opaque pixels.
     */
    public Optional<FrameMeasurement> measure(PixelBuffer frame, double rootZoneRatio) {
        return findBounds(frame).flatMap(bounds -> measureWithin(frame, bounds, rootZoneRatio));
    }

    public Optional<FrameBounds> findBounds(PixelBuffer image) {
        int bottomY = -1;
        for (int y = image.height() - 1; y >= 0 && bottomY < 0; y--) {
            if (rowHasOpaque(image, y)) {
                bottomY = y;
            }
        }
        if (bottomY < 0) {
            return Optional.empty();
        }

        int topY = 0;
        for (int y = 0; y <= bottomY; y++) {
            if (rowHasOpaque(image, y)) {
                topY = y;
                break;
            }
        }

        int leftX = image.width();
        int rightX = -1;
        for (int y = topY; y <= bottomY; y++) {
            for (int x = 0; x < image.width(); x++) {
                if (image.isOpaque(x, y)) {
                    leftX = Math.min(leftX, x);
                    rightX = Math.max(rightX, x);
                }
            }
        }
        return Optional.of(new FrameBounds(topY, bottomY, leftX, rightX));
    }

    private Optional<FrameMeasurement> measureWithin(PixelBuffer image, FrameBounds bounds, double rootZoneRatio) {
        int rootZoneHeight = Math.max(1, (int) Math.floor(bounds.visibleHeight() * rootZoneRatio));
        int startY = Math.max(0, bounds.bottomY() - rootZoneHeight);

        long sumX = 0;
        long count = 0;
        for (int y = startY; y <= bounds.bottomY(); y++) {
            for (int x = 0; x < image.width(); x++) {
                if (image.isOpaque(x, y)) {
                    sumX += x;
                    count++;
                }
            }
        }
        if (count == 0) {
            return Optional.empty();
        }
        int rootX = (int) Math.round((double) sumX / count);
        return Optional.of(new FrameMeasurement(bounds, rootX, rootZoneHeight));
    }

    private boolean rowHasOpaque(PixelBuffer image, int y) {
        for (int x = 0; x < image.width(); x++) {
            if (image.isOpaque(x, y)) {
                return true;
            }
        }
        return false;
    }
}
