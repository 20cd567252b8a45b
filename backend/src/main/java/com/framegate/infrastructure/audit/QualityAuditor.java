package com.framegate.infrastructure.audit;

import com.framegate.domain.frame.model.AuditResult;
import com.framegate.domain.frame.model.Metric;
import com.framegate.domain.frame.model.NormalizedFrame;
import com.framegate.domain.frame.model.PixelBuffer;
import com.framegate.domain.frame.model.ReasonCode;
import com.framegate.infrastructure.audit.metrics.AlphaHaloDetector;
import com.framegate.infrastructure.audit.metrics.BaselineDriftDetector;
import com.framegate.infrastructure.audit.metrics.CompositeScorer;
import com.framegate.infrastructure.audit.metrics.DriftReport;
import com.framegate.infrastructure.audit.metrics.HaloReport;
import com.framegate.infrastructure.audit.metrics.MapdCalculator;
import com.framegate.infrastructure.audit.metrics.OrphanPixelDetector;
import com.framegate.infrastructure.audit.metrics.OrphanReport;
import com.framegate.infrastructure.audit.metrics.PaletteFidelityCalculator;
import com.framegate.infrastructure.audit.metrics.PaletteReport;
import com.framegate.infrastructure.audit.metrics.SsimCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Scores a normalized frame.
 * <p>
 * Hard gates run first and short-circuit: once one fails no soft metric is computed. Otherwise
 * every soft metric runs and each miss appends its reason code, in a fixed order, so the retry
 * ladder always sees the same list for the same frame.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QualityAuditor {

    private final HardGateEvaluator hardGateEvaluator;
    private final SsimCalculator ssimCalculator;
    private final PaletteFidelityCalculator paletteCalculator;
    private final AlphaHaloDetector haloDetector;
    private final BaselineDriftDetector driftDetector;
    private final OrphanPixelDetector orphanDetector;
    private final MapdCalculator mapdCalculator;
    private final CompositeScorer compositeScorer;

    private final AtomicLong softMetricComputations = new AtomicLong();

    public AuditResult audit(NormalizedFrame frame, AuditContext ctx) {
        AuditThresholds t = ctx.thresholds();

        Optional<ReasonCode> hardFailure = hardGateEvaluator.evaluate(frame, ctx.targetSize(), t);
        if (hardFailure.isPresent()) {
            return new AuditResult(List.of(hardFailure.get()), frame.warnings(),
                    new EnumMap<>(Metric.class), 0.0, 0);
        }

        PixelBuffer pixels = frame.pixels();
        List<ReasonCode> reasons = new ArrayList<>();
        List<ReasonCode> warnings = new ArrayList<>(frame.warnings());
        Map<Metric, Double> scores = new EnumMap<>(Metric.class);
        int computed = 0;

        // Identity
        double identity = ssimCalculator.compute(pixels, ctx.anchor());
        computed++;
        scores.put(Metric.IDENTITY, identity);
        if (identity < t.identityMin()) {
            reasons.add(ReasonCode.SF01_IDENTITY_DRIFT);
        }

        // Palette
        PaletteReport palette = paletteCalculator.compute(pixels, ctx.palette(), t.paletteTolerance());
        computed++;
        scores.put(Metric.PALETTE, palette.fidelity());
        if (palette.fidelity() < t.paletteMin()) {
            reasons.add(ReasonCode.SF02_PALETTE_DRIFT);
            log.info("[Auditor] Frame {} palette fidelity {} (top off-palette: {})",
                    frame.frameIndex(), format(palette.fidelity()), palette.topOffPalette());
        }

        // Alpha halo
        HaloReport halo = haloDetector.compute(pixels);
        computed++;
        scores.put(Metric.ALPHA_HALO, halo.ratio());
        if (halo.ratio() > t.alphaArtifactMax()) {
            reasons.add(ReasonCode.SF03_ALPHA_HALO);
        }

        // Baseline drift residual
        DriftReport drift = driftDetector.compute(pixels, ctx.anchorTarget(), ctx.rootZoneRatio());
        computed++;
        scores.put(Metric.BASELINE_DRIFT, (double) drift.verticalDrift());
        scores.put(Metric.ROOT_DRIFT, (double) drift.horizontalDrift());
        scores.put(Metric.ALIGNMENT_RESIDUAL, (double) drift.residual());
        if (drift.residual() > ctx.maxShiftX() || frame.wasClamped()) {
            log.warn("[Auditor] Safety valve residual on frame {}: residual={}px (vertical={}, horizontal={}), clamped={}",
                    frame.frameIndex(), drift.residual(), drift.verticalDrift(), drift.horizontalDrift(), frame.wasClamped());
        }
        if (drift.residual() > t.baselineDriftMax()) {
            reasons.add(ReasonCode.SF04_BASELINE_DRIFT);
            log.info("[Auditor] Frame {} baseline drift {}px ({})", frame.frameIndex(), drift.verticalDrift(),
                    drift.verticalDrift() > 0 ? "sinking" : drift.verticalDrift() < 0 ? "floating" : "root offset");
        }

        // Orphan noise
        OrphanReport orphans = orphanDetector.compute(pixels);
        computed++;
        scores.put(Metric.ORPHAN_COUNT, (double) orphans.count());
        if (orphans.count() > t.orphanMax()) {
            reasons.add(ReasonCode.SF05_PIXEL_NOISE);
        } else if (orphans.count() > t.orphanWarn()) {
            warnings.add(ReasonCode.SF05_PIXEL_NOISE);
        }

        // Temporal coherence
        if (ctx.previousApproved() != null && !t.bypassesTemporalCheck(ctx.moveType())) {
            double mapd = mapdCalculator.compute(pixels, ctx.previousApproved());
            computed++;
            scores.put(Metric.MAPD, mapd);
            if (mapd > t.mapdThresholdFor(ctx.moveType())) {
                reasons.add(ReasonCode.SF06_TEMPORAL_FLICKER);
            }
        }

        // Composite
        double stability = compositeScorer.stability(drift.residual(), ctx.maxShiftX());
        double style = compositeScorer.style(orphans.count(), t.orphanMax(), halo.ratio());
        scores.put(Metric.STABILITY, stability);
        scores.put(Metric.STYLE, style);
        double composite = compositeScorer.score(stability, identity, palette.fidelity(), style, t.weights());
        if (composite < t.compositeMin()) {
            reasons.add(ReasonCode.SF07_COMPOSITE_LOW);
        }

        softMetricComputations.addAndGet(computed);
        log.info("[Auditor] Frame {} attempt {}: composite={}, identity={}, reasons={}",
                frame.frameIndex(), frame.attemptIndex(), format(composite), format(identity), reasons);

        return new AuditResult(List.copyOf(reasons), List.copyOf(warnings), scores, composite, computed);
    }

    /** Soft metrics computed since startup. */
    public long softMetricComputations() {
        return softMetricComputations.get();
    }

    private static String format(double value) {
        return String.format("%.3f", value);
    }
}
