package com.framegate.support;

import com.framegate.infrastructure.audit.HardGateEvaluator;
import com.framegate.infrastructure.audit.QualityAuditor;
import com.framegate.infrastructure.audit.metrics.AlphaHaloDetector;
import com.framegate.infrastructure.audit.metrics.BaselineDriftDetector;
import com.framegate.infrastructure.audit.metrics.CompositeScorer;
import com.framegate.infrastructure.audit.metrics.MapdCalculator;
import com.framegate.infrastructure.audit.metrics.OrphanPixelDetector;
import com.framegate.infrastructure.audit.metrics.PaletteFidelityCalculator;
import com.framegate.infrastructure.audit.metrics.SsimCalculator;
import com.framegate.infrastructure.imaging.AnchorAnalyzer;
import com.framegate.infrastructure.imaging.ImageCodec;

public final class Auditors {

    private Auditors() {
    }

    public static QualityAuditor create(ImageCodec codec, AnchorAnalyzer analyzer) {
        return new QualityAuditor(
                new HardGateEvaluator(codec),
                new SsimCalculator(),
                new PaletteFidelityCalculator(),
                new AlphaHaloDetector(),
                new BaselineDriftDetector(analyzer),
                new OrphanPixelDetector(),
                new MapdCalculator(),
                new CompositeScorer());
    }
}
