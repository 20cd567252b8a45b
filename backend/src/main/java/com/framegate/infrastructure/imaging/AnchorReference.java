package com.framegate.infrastructure.imaging;

import com.framegate.domain.frame.exception.ConfigException;
import com.framegate.domain.frame.model.AlignmentTarget;
import com.framegate.domain.frame.model.PixelBuffer;

/**
 * Per-run holder of the anchor image and its alignment target. The target is computed on first
 * access and returned unchanged afterwards.
 */
public final class AnchorReference {

    private final PixelBuffer image;
    private final AnchorAnalyzer analyzer;
    private final double rootZoneRatio;

    private AlignmentTarget target;
    private int analysisCount;

    public AnchorReference(PixelBuffer image, AnchorAnalyzer analyzer, double rootZoneRatio) {
        this.image = image.copy();
        this.analyzer = analyzer;
        this.rootZoneRatio = rootZoneRatio;
    }

    public synchronized AlignmentTarget target() {
        if (target == null) {
            AnchorAnalysis analysis = analyzer.analyze(image, rootZoneRatio);
            analysisCount++;
            if (!analysis.ok()) {
                throw new ConfigException("Anchor analysis failed: " + analysis.errorCode() + " - " + analysis.message());
            }
            target = analysis.target();
        }
        return target;
    }

    public PixelBuffer image() {
        return image.copy();
    }

    public synchronized int analysisCount() {
        return analysisCount;
    }
}
