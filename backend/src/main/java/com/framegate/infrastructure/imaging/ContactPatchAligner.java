package com.framegate.infrastructure.imaging;

import com.framegate.domain.frame.model.AlignmentConfig;
import com.framegate.domain.frame.model.AlignmentMethod;
import com.framegate.domain.frame.model.AlignmentResult;
import com.framegate.domain.frame.model.AlignmentTarget;
import com.framegate.domain.frame.model.PixelBuffer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Shifts a candidate so its contact patch lands on the anchor's.
 * <p>
 * The shift is a pure integer translation into a transparent canvas of the same size. Pixels
 * are copied, never resampled or blended. The horizontal correction is bounded by the
 * {@code maxShiftX} safety valve; the vertical correction is not.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContactPatchAligner {

    private final AnchorAnalyzer anchorAnalyzer;

    public AlignmentResult align(PixelBuffer frame, AlignmentTarget target, AlignmentConfig config) {
        if (config.method() == AlignmentMethod.NONE) {
            return AlignmentResult.unchanged(frame);
        }

        Optional<FrameMeasurement> measured = anchorAnalyzer.measure(frame, config.rootZoneRatio());
        if (measured.isEmpty()) {
            // Empty frames are left for the hard gates
            return AlignmentResult.unchanged(frame);
        }
        FrameMeasurement m = measured.get();

        int currentX = config.method() == AlignmentMethod.CENTER ? m.bounds().centerX() : m.rootX();
        int targetX = config.method() == AlignmentMethod.CENTER ? target.centerX() : target.rootX();

        int requestedShiftX = targetX - currentX;
        int shiftY = config.verticalLock() ? target.baselineY() - m.bottomY() : 0;

        int shiftX = requestedShiftX;
        boolean clamped = false;
        if (Math.abs(requestedShiftX) > config.maxShiftX()) {
            shiftX = Integer.signum(requestedShiftX) * config.maxShiftX();
            clamped = true;
            log.warn("[Aligner] Safety valve triggered: requested shiftX={} clamped to {} (maxShiftX={})",
                    requestedShiftX, shiftX, config.maxShiftX());
        }

        log.debug("[Aligner] method={}, shiftX={}, shiftY={}, clamped={}",
                config.method(), shiftX, shiftY, clamped);

        PixelBuffer shifted = (shiftX == 0 && shiftY == 0) ? frame.copy() : translate(frame, shiftX, shiftY);
        return new AlignmentResult(shifted, shiftX, shiftY, clamped, requestedShiftX);
    }

    /**
     * Integer translation: content moved by (dx, dy), vacated pixels fully transparent,
     * pixels pushed past the edge cropped.
     */
    public static PixelBuffer translate(PixelBuffer source, int dx, int dy) {
        PixelBuffer result = new PixelBuffer(source.width(), source.height());
        for (int y = 0; y < source.height(); y++) {
            int destY = y + dy;
            if (destY < 0 || destY >= source.height()) {
                continue;
            }
            for (int x = 0; x < source.width(); x++) {
                int destX = x + dx;
                if (destX < 0 || destX >= source.width()) {
                    continue;
                }
                result.set(destX, destY, source.get(x, y));
            }
        }
        return result;
    }
}
