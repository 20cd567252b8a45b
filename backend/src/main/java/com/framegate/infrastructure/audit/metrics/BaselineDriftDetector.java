package com.framegate.infrastructure.audit.metrics;

import com.framegate.domain.frame.model.AlignmentTarget;
import com.framegate.domain.frame.model.PixelBuffer;
import com.framegate.infrastructure.imaging.AnchorAnalyzer;
import com.framegate.infrastructure.imaging.FrameMeasurement;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Residual misalignment left after the aligner ran, measured with the anchor analyzer so that
 * it is comparable with the anchor target.
 */
@Component
@RequiredArgsConstructor
public class BaselineDriftDetector {

    private final AnchorAnalyzer anchorAnalyzer;

    public DriftReport compute(PixelBuffer frame, AlignmentTarget anchorTarget, double rootZoneRatio) {
        Optional<FrameMeasurement> measured = anchorAnalyzer.measure(frame, rootZoneRatio);
        if (measured.isEmpty()) {
            int worst = Math.max(frame.width(), frame.height());
            return new DriftReport(worst, worst, worst);
        }
        int vertical = measured.get().bottomY() - anchorTarget.baselineY();
        int horizontal = measured.get().rootX() - anchorTarget.rootX();
        return new DriftReport(vertical, horizontal, Math.max(Math.abs(vertical), Math.abs(horizontal)));
    }
}
