package com.framegate.infrastructure.config;

import com.framegate.domain.frame.exception.ConfigException;
import com.framegate.domain.frame.model.AlignmentConfig;
import com.framegate.domain.frame.model.AlignmentMethod;
import com.framegate.domain.frame.model.CanvasConfig;
import com.framegate.domain.frame.model.ManifestThresholds;
import com.framegate.domain.frame.model.RetryAction;
import com.framegate.domain.frame.model.RunManifest;
import com.framegate.domain.frame.model.TransparencyConfig;
import com.framegate.domain.frame.model.TransparencyStrategy;
import com.framegate.infrastructure.audit.AuditThresholds;
import com.framegate.infrastructure.audit.metrics.CompositeWeights;
import com.framegate.infrastructure.imaging.ColorMath;
import com.framegate.infrastructure.pipeline.PipelineSettings;
import com.framegate.infrastructure.pipeline.PromptTemplates;
import com.framegate.infrastructure.pipeline.StopConditions;
import com.framegate.infrastructure.retry.RetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Resolves {@link FrameGateProperties} plus per-manifest overrides into the immutable settings of
 * one run. Every invalid value is reported as a {@link ConfigException} before any frame runs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineSettingsFactory {

    static final int MAX_FRAME_COUNT = 10_000;
    private static final Pattern MOVE_ID = Pattern.compile("^[a-z_]+$");
    private static final Pattern RUN_ID = Pattern.compile("^[A-Za-z0-9_-]+$");
    private static final String DEFAULT_MAPD_KEY = "default";

    private final FrameGateProperties properties;

    public PipelineSettings resolve(RunManifest manifest) {
        validateManifest(manifest);

        AlignmentConfig alignment = alignment(properties.getAlignment());
        CanvasConfig canvas = canvas(properties.getCanvas());
        TransparencyConfig transparency = transparency(properties.getTransparency());
        AuditThresholds thresholds = thresholds(properties.getAuditor(), manifest.thresholds());
        RetryPolicy retry = retryPolicy(properties.getRetry());
        StopConditions stopConditions = stopConditions(properties.getRetry().getStopConditions());

        FrameGateProperties.Retry retryProps = properties.getRetry();
        if (retryProps.getMaxRateLimitWaits() < 0) {
            throw new ConfigException("framegate.retry.max-rate-limit-waits must not be negative");
        }
        Duration backoff = retryProps.getDefaultBackoff();
        if (backoff == null || backoff.isNegative()) {
            throw new ConfigException("framegate.retry.default-backoff must be a non-negative duration");
        }

        return new PipelineSettings(alignment, canvas, transparency, thresholds, retry, stopConditions,
                prompts(properties.getPrompts()), retryProps.getMaxRateLimitWaits(), backoff);
    }

    // ===== Manifest =====

    void validateManifest(RunManifest manifest) {
        if (manifest == null) {
            throw new ConfigException("Manifest is required");
        }
        if (manifest.runId() == null || !RUN_ID.matcher(manifest.runId()).matches()) {
            throw new ConfigException("runId must match " + RUN_ID.pattern() + ": " + manifest.runId());
        }
        if (manifest.moveId() == null || !MOVE_ID.matcher(manifest.moveId()).matches()) {
            throw new ConfigException("moveId must match " + MOVE_ID.pattern() + ": " + manifest.moveId());
        }
        if (manifest.frameCount() < 1 || manifest.frameCount() > MAX_FRAME_COUNT) {
            throw new ConfigException("frameCount must be between 1 and " + MAX_FRAME_COUNT + ": " + manifest.frameCount());
        }
        if (manifest.anchorPath() == null || manifest.anchorPath().isBlank()) {
            throw new ConfigException("anchorPath is required");
        }
        if (manifest.palette() != null) {
            manifest.palette().forEach(ColorMath::parseHex);
        }
    }

    // ===== Sections =====

    private AlignmentConfig alignment(FrameGateProperties.Alignment props) {
        AlignmentMethod method = enumValue(AlignmentMethod.class, props.getMethod(), "framegate.alignment.method");
        if (props.getRootZoneRatio() < AlignmentConfig.MIN_ROOT_ZONE_RATIO
                || props.getRootZoneRatio() > AlignmentConfig.MAX_ROOT_ZONE_RATIO) {
            throw new ConfigException("framegate.alignment.root-zone-ratio must be between "
                    + AlignmentConfig.MIN_ROOT_ZONE_RATIO + " and " + AlignmentConfig.MAX_ROOT_ZONE_RATIO
                    + ": " + props.getRootZoneRatio());
        }
        if (props.getMaxShiftX() < 0) {
            throw new ConfigException("framegate.alignment.max-shift-x must not be negative");
        }
        return new AlignmentConfig(method, props.isVerticalLock(), props.getRootZoneRatio(), props.getMaxShiftX());
    }

    private CanvasConfig canvas(FrameGateProperties.Canvas props) {
        int generation = props.getGenerationSize();
        int target = props.getTargetSize();
        if (generation <= 0 || target <= 0) {
            throw new ConfigException("Canvas sizes must be positive: " + generation + "/" + target);
        }
        if (generation % target != 0) {
            throw new ConfigException("framegate.canvas.generation-size " + generation
                    + " must be an integer multiple of target-size " + target);
        }
        return new CanvasConfig(generation, target);
    }

    private TransparencyConfig transparency(FrameGateProperties.Transparency props) {
        TransparencyStrategy strategy = enumValue(TransparencyStrategy.class, props.getStrategy(),
                "framegate.transparency.strategy");
        if (props.getChromaTolerance() < 0) {
            throw new ConfigException("framegate.transparency.chroma-tolerance must not be negative");
        }
        return new TransparencyConfig(strategy, ColorMath.parseHex(props.getChromaColor()), props.getChromaTolerance());
    }

    private AuditThresholds thresholds(FrameGateProperties.Auditor auditor, ManifestThresholds overrides) {
        FrameGateProperties.Thresholds props = auditor.getThresholds();
        double identityMin = props.getIdentityMin();
        double paletteMin = props.getPaletteMin();
        double alphaMax = props.getAlphaArtifactMax();
        int driftMax = props.getBaselineDriftMax();
        double compositeMin = props.getCompositeMin();

        if (overrides != null) {
            if (overrides.identityMin() != null) {
                identityMin = overrides.identityMin();
            }
            if (overrides.paletteMin() != null) {
                paletteMin = overrides.paletteMin();
            }
            if (overrides.alphaArtifactMax() != null) {
                alphaMax = overrides.alphaArtifactMax();
            }
            if (overrides.baselineDriftMax() != null) {
                driftMax = (int) Math.round(overrides.baselineDriftMax());
            }
            if (overrides.compositeMin() != null) {
                compositeMin = overrides.compositeMin();
            }
        }

        requireFraction("identity-min", identityMin);
        requireFraction("palette-min", paletteMin);
        requireFraction("alpha-artifact-max", alphaMax);
        requireFraction("composite-min", compositeMin);
        if (driftMax < 0) {
            throw new ConfigException("baseline-drift-max must not be negative: " + driftMax);
        }
        if (props.getOrphanWarn() < 0 || props.getOrphanMax() < props.getOrphanWarn()) {
            throw new ConfigException("orphan thresholds must satisfy 0 <= orphan-warn <= orphan-max");
        }
        if (props.getMinFileBytes() < 0 || props.getMaxFileBytes() <= props.getMinFileBytes()) {
            throw new ConfigException("file size bounds must satisfy 0 <= min-file-bytes < max-file-bytes");
        }

        FrameGateProperties.Weights w = auditor.getWeights();
        CompositeWeights weights = new CompositeWeights(w.getStability(), w.getIdentity(), w.getPalette(), w.getStyle());
        if (weights.stability() < 0 || weights.identity() < 0 || weights.palette() < 0 || weights.style() < 0
                || Math.abs(weights.total() - 1.0) > 1e-6) {
            throw new ConfigException("Composite weights must be non-negative and sum to 1.0: " + weights);
        }

        Map<String, Double> mapd = new LinkedHashMap<>();
        auditor.getMapd().forEach((moveType, limit) -> mapd.put(moveType.trim().toLowerCase(Locale.ROOT), limit));
        Double mapdDefault = mapd.remove(DEFAULT_MAPD_KEY);
        if (mapdDefault == null) {
            mapdDefault = AuditThresholds.defaults().mapdDefault();
            log.warn("[Config] No default MAPD threshold configured, using {}", mapdDefault);
        }
        Set<String> bypass = auditor.getMapdBypass().stream()
                .map(type -> type.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(TreeSet::new));

        return new AuditThresholds(identityMin, paletteMin, props.getPaletteTolerance(), alphaMax, driftMax,
                props.getOrphanWarn(), props.getOrphanMax(), compositeMin,
                props.getMinFileBytes(), props.getMaxFileBytes(), weights,
                Map.copyOf(mapd), mapdDefault, bypass);
    }

    private RetryPolicy retryPolicy(FrameGateProperties.Retry props) {
        List<RetryAction> order = props.getLadderOrder().stream()
                .map(name -> enumValue(RetryAction.class, name, "framegate.retry.ladder-order"))
                .toList();
        for (RetryAction action : order) {
            if (action.getLevel() < 1) {
                throw new ConfigException("framegate.retry.ladder-order may only list recovery actions: " + action);
            }
        }
        if (order.stream().distinct().count() != order.size()) {
            throw new ConfigException("framegate.retry.ladder-order contains duplicates: " + order);
        }
        if (props.getMaxAttemptsPerFrame() < 1) {
            throw new ConfigException("framegate.retry.max-attempts-per-frame must be at least 1");
        }
        return new RetryPolicy(order, props.getMaxAttemptsPerFrame());
    }

    private StopConditions stopConditions(FrameGateProperties.StopConditions props) {
        requireFraction("max-retry-rate", props.getMaxRetryRate());
        requireFraction("max-reject-rate", props.getMaxRejectRate());
        if (props.getMaxConsecutiveFails() < 0 || props.getCircuitBreakerLimit() < 1) {
            throw new ConfigException("max-consecutive-fails must be >= 0 and circuit-breaker-limit >= 1");
        }
        return new StopConditions(props.getMaxRetryRate(), props.getMaxRejectRate(),
                props.getMaxConsecutiveFails(), props.getCircuitBreakerLimit());
    }

    private PromptTemplates prompts(FrameGateProperties.Prompts props) {
        PromptTemplates defaults = PromptTemplates.defaults();
        return new PromptTemplates(
                orDefault(props.getMaster(), defaults.master()),
                orDefault(props.getVariation(), defaults.variation()),
                orDefault(props.getLock(), defaults.lock()),
                orDefault(props.getNegative(), defaults.negative()),
                orDefault(props.getLoopClosure(), defaults.loopClosure()));
    }

    // ===== Helpers =====

    private static void requireFraction(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ConfigException(name + " must be between 0 and 1: " + value);
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    /** Accepts {@code kebab-case} or {@code UPPER_SNAKE} spellings. */
    static <E extends Enum<E>> E enumValue(Class<E> type, String raw, String property) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigException(property + " is required");
        }
        String name = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Unknown value '" + raw + "' for " + property, e);
        }
    }
}
