package com.framegate.infrastructure.export;

import com.framegate.domain.frame.model.AssertionResult;
import com.framegate.domain.frame.model.AtlasAssertion;
import com.framegate.domain.frame.model.AtlasRect;
import com.framegate.domain.frame.model.AtlasValidationReport;
import com.framegate.domain.frame.model.FrameBounds;
import com.framegate.domain.frame.model.PackedAtlas;
import com.framegate.domain.frame.service.ValidatorAdapter;
import com.framegate.infrastructure.imaging.AnchorAnalyzer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Structural checks on a packed atlas: frame key naming, identical cell sizes (shared pivot)
 * and a stable ground line across frames.
 */
@Slf4j
@Component
public class AtlasStructureValidator implements ValidatorAdapter {

    private final AnchorAnalyzer anchorAnalyzer;
    private final int baselineDriftMax;

    public AtlasStructureValidator(AnchorAnalyzer anchorAnalyzer,
                                   @Value("${framegate.auditor.thresholds.baseline-drift-max:1}") int baselineDriftMax) {
        this.anchorAnalyzer = anchorAnalyzer;
        this.baselineDriftMax = baselineDriftMax;
    }

    @Override
    public AtlasValidationReport validate(PackedAtlas atlas, Set<AtlasAssertion> assertions) {
        List<AssertionResult> results = new ArrayList<>();
        for (AtlasAssertion assertion : EnumSet.copyOf(assertions)) {
            AssertionResult result = switch (assertion) {
                case NAMING_CONVENTION -> checkNaming(atlas.frames());
                case PIVOT_CONSISTENCY -> checkPivots(atlas.frames());
                case BASELINE_STABILITY -> checkBaselines(atlas);
            };
            if (!result.passed()) {
                log.warn("[Validator] {} failed: {}", assertion, result.message());
            }
            results.add(result);
        }
        return new AtlasValidationReport(results, List.of());
    }

    public AtlasValidationReport validateAll(PackedAtlas atlas) {
        return validate(atlas, EnumSet.allOf(AtlasAssertion.class));
    }

    private AssertionResult checkNaming(Map<String, AtlasRect> frames) {
        List<String> invalid = frames.keySet().stream().filter(key -> !FrameNaming.isValidKey(key)).toList();
        if (!invalid.isEmpty()) {
            return new AssertionResult(AtlasAssertion.NAMING_CONVENTION, false, "Invalid frame keys: " + invalid);
        }
        List<Integer> gaps = FrameNaming.findGaps(frames.keySet());
        if (!gaps.isEmpty()) {
            return new AssertionResult(AtlasAssertion.NAMING_CONVENTION, false, "Missing frame indices: " + gaps);
        }
        return new AssertionResult(AtlasAssertion.NAMING_CONVENTION, true, frames.size() + " frame keys valid");
    }

    private AssertionResult checkPivots(Map<String, AtlasRect> frames) {
        long sizes = frames.values().stream().map(r -> r.width() + "x" + r.height()).distinct().count();
        if (sizes > 1) {
            return new AssertionResult(AtlasAssertion.PIVOT_CONSISTENCY, false,
                    "Frames have " + sizes + " different cell sizes");
        }
        return new AssertionResult(AtlasAssertion.PIVOT_CONSISTENCY, true, "All frames share one cell size");
    }

    private AssertionResult checkBaselines(PackedAtlas atlas) {
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (Map.Entry<String, AtlasRect> entry : atlas.frames().entrySet()) {
            Optional<FrameBounds> bounds = anchorAnalyzer.findBounds(GridAtlasPacker.crop(atlas.image(), entry.getValue()));
            if (bounds.isEmpty()) {
                return new AssertionResult(AtlasAssertion.BASELINE_STABILITY, false,
                        "Frame " + entry.getKey() + " has no opaque pixels");
            }
            min = Math.min(min, bounds.get().bottomY());
            max = Math.max(max, bounds.get().bottomY());
        }
        int spread = atlas.frames().isEmpty() ? 0 : max - min;
        if (spread > baselineDriftMax) {
            return new AssertionResult(AtlasAssertion.BASELINE_STABILITY, false,
                    "Baseline varies by " + spread + "px across frames (max " + baselineDriftMax + ")");
        }
        return new AssertionResult(AtlasAssertion.BASELINE_STABILITY, true, "Baseline spread " + spread + "px");
    }
}
