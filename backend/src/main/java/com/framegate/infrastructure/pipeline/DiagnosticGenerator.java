package com.framegate.infrastructure.pipeline;

import com.framegate.domain.frame.model.AttemptRecord;
import com.framegate.domain.frame.model.FrameState;
import com.framegate.domain.frame.model.FrameStatus;
import com.framegate.domain.frame.model.ReasonCode;
import com.framegate.domain.frame.model.RetryAction;
import com.framegate.domain.frame.model.RunState;
import com.framegate.domain.frame.model.StopCondition;
import com.framegate.domain.frame.model.StopReason;
import com.framegate.infrastructure.pipeline.DiagnosticReport.Confidence;
import com.framegate.infrastructure.pipeline.DiagnosticReport.FailureTally;
import com.framegate.infrastructure.pipeline.DiagnosticReport.FrameBreakdown;
import com.framegate.infrastructure.pipeline.DiagnosticReport.RecoveryAction;
import com.framegate.infrastructure.pipeline.DiagnosticReport.RootCause;
import com.framegate.infrastructure.pipeline.DiagnosticReport.RunSummary;
import com.framegate.infrastructure.pipeline.DiagnosticReport.StopSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the post-mortem report for a stopped or failed run.
 */
@Slf4j
@Component
public class DiagnosticGenerator {

    private static final int TOP_FAILURES = 3;
    private static final int EXAMPLE_FRAMES = 3;
    private static final int MAX_RECOVERY_ACTIONS = 4;

    // ===== Recovery actions =====

    private record RecoveryRule(RecoveryAction action, Set<ReasonCode> appliesTo, boolean onConsecutiveFails) {
    }

    private static final List<RecoveryRule> RECOVERY_RULES = List.of(
            new RecoveryRule(new RecoveryAction("Increase anchor resolution",
                    "Use a larger anchor image with clear, high-contrast details", 1),
                    Set.of(ReasonCode.SF01_IDENTITY_DRIFT, ReasonCode.HF_IDENTITY_COLLAPSE), false),
            new RecoveryRule(new RecoveryAction("Loosen identity threshold",
                    "Lower framegate.auditor.thresholds.identity-min for this move", 2),
                    Set.of(ReasonCode.SF01_IDENTITY_DRIFT), false),
            new RecoveryRule(new RecoveryAction("Expand color palette",
                    "Add highlight and shadow variants of the main colors to the manifest palette", 3),
                    Set.of(ReasonCode.SF02_PALETTE_DRIFT), false),
            new RecoveryRule(new RecoveryAction("Simplify animation",
                    "Reduce the frame count or choose smaller pose transitions", 4),
                    Set.of(ReasonCode.HF_IDENTITY_COLLAPSE), true),
            new RecoveryRule(new RecoveryAction("Review anchor pose",
                    "Make sure the anchor shows a neutral pose with both feet on the ground line", 5),
                    Set.of(ReasonCode.SF04_BASELINE_DRIFT, ReasonCode.HF_IDENTITY_COLLAPSE), false),
            new RecoveryRule(new RecoveryAction("Adjust negative prompt",
                    "Add avoidance terms for the observed artifacts", 6),
                    Set.of(ReasonCode.SF02_PALETTE_DRIFT, ReasonCode.SF03_ALPHA_HALO, ReasonCode.SF_FRINGE_RISK), false),
            new RecoveryRule(new RecoveryAction("Switch transparency strategy",
                    "Use chroma-key removal when the generator returns opaque backgrounds", 7),
                    Set.of(ReasonCode.HF04_WRONG_COLOR_DEPTH, ReasonCode.SF03_ALPHA_HALO), false),
            new RecoveryRule(new RecoveryAction("Check generator availability",
                    "Verify the API key, quota and model name before re-running", 8),
                    Set.of(ReasonCode.SYS_GENERATION_FAILED, ReasonCode.SYS_GENERATOR_TRANSIENT), false));

    public DiagnosticReport generate(RunState state, StopReason stopReason, Instant now) {
        List<FrameBreakdown> breakdown = state.getFrames().stream().map(this::breakdown).toList();
        List<FailureTally> topFailures = tallyFailures(breakdown);

        int attempted = (int) state.getFrames().stream().filter(f -> f.attemptCount() > 0).count();
        RunSummary summary = new RunSummary(
                state.totalFrames(),
                attempted,
                (int) state.countWithStatus(FrameStatus.APPROVED),
                (int) state.countWithStatus(FrameStatus.REJECTED),
                state.getTotalAttempts(),
                attempted == 0 ? 0.0 : (double) state.getTotalAttempts() / attempted);

        StopSummary stop = stopReason == null ? null
                : new StopSummary(stopReason.condition(), stopReason.threshold(), stopReason.value(), stopReason.message());

        DiagnosticReport report = new DiagnosticReport(state.getRunId(), now, stop, summary, breakdown, topFailures,
                rootCause(topFailures, stopReason), recoveryActions(topFailures, stopReason));
        log.info("[Diagnostic] Run {}: stop={}, top failures={}", state.getRunId(),
                stopReason == null ? "none" : stopReason.condition(),
                topFailures.stream().map(FailureTally::code).toList());
        return report;
    }

    private FrameBreakdown breakdown(FrameState frame) {
        Set<ReasonCode> codes = new LinkedHashSet<>();
        Set<RetryAction> actions = new LinkedHashSet<>();
        List<Double> composites = new ArrayList<>();
        for (AttemptRecord attempt : frame.getAttempts()) {
            codes.addAll(attempt.reasonCodes());
            if (attempt.compositeScore() != null) {
                composites.add(attempt.compositeScore());
            }
            if (attempt.strategy() != null) {
                actions.add(attempt.strategy());
            }
        }
        return new FrameBreakdown(frame.getIndex(), frame.getStatus(), frame.attemptCount(),
                List.copyOf(codes), composites, List.copyOf(actions));
    }

    List<FailureTally> tallyFailures(List<FrameBreakdown> breakdown) {
        Map<ReasonCode, Integer> counts = new EnumMap<>(ReasonCode.class);
        Map<ReasonCode, List<Integer>> frames = new EnumMap<>(ReasonCode.class);
        for (FrameBreakdown frame : breakdown) {
            for (ReasonCode code : frame.reasonCodes()) {
                counts.merge(code, 1, Integer::sum);
                frames.computeIfAbsent(code, c -> new ArrayList<>()).add(frame.frameIndex());
            }
        }
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        return counts.entrySet().stream()
                .sorted(Map.Entry.<ReasonCode, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<ReasonCode, Integer>comparingByKey()))
                .limit(TOP_FAILURES)
                .map(e -> new FailureTally(e.getKey(), e.getValue(),
                        total == 0 ? 0.0 : e.getValue() * 100.0 / total,
                        frames.get(e.getKey()).stream().limit(EXAMPLE_FRAMES).toList()))
                .toList();
    }

    RootCause rootCause(List<FailureTally> topFailures, StopReason stopReason) {
        boolean collapse = topFailures.stream().anyMatch(f -> f.code() == ReasonCode.HF_IDENTITY_COLLAPSE);
        if (collapse) {
            return new RootCause("Identity collapse indicates the anchor cannot be held through these poses.",
                    Confidence.HIGH, List.of(
                    "Anchor lacks resolution for extreme pose angles",
                    "Model unable to maintain identity through the pose transition"));
        }
        if (topFailures.isEmpty()) {
            if (stopReason != null && stopReason.condition() == StopCondition.USER_INTERRUPT) {
                return new RootCause("Run was interrupted by the user.", Confidence.HIGH, List.of());
            }
            return new RootCause("No frame-level failures recorded.", Confidence.LOW, List.of());
        }

        FailureTally top = topFailures.get(0);
        String share = String.format("%s accounts for %.0f%% of all failures", top.code(), top.percentage());
        return switch (top.code()) {
            case SF01_IDENTITY_DRIFT -> new RootCause(
                    "Anchor image may lack distinctive features or resolution for reliable identity matching.",
                    top.percentage() > 50 ? Confidence.HIGH : Confidence.MEDIUM,
                    List.of("Low contrast in anchor image", "Anchor pose too different from the animation poses", share));
            case SF02_PALETTE_DRIFT -> new RootCause(
                    "Palette constraints may be too strict for the generation model.",
                    Confidence.MEDIUM,
                    List.of("Palette missing shading colors", "Palette has near-duplicate colors", share));
            case SF03_ALPHA_HALO, SF_FRINGE_RISK, HF04_WRONG_COLOR_DEPTH -> new RootCause(
                    "Transparency is not clean; edges carry semi-transparent or background-colored pixels.",
                    Confidence.MEDIUM,
                    List.of("Generator is anti-aliasing sprite edges", "Chroma key tolerance too low", share));
            case SF04_BASELINE_DRIFT -> new RootCause(
                    "Contact patch detection may be struggling with the character design.",
                    Confidence.MEDIUM,
                    List.of("Character has unclear ground contact", "Non-standard proportions", share));
            case SF05_PIXEL_NOISE, SF06_TEMPORAL_FLICKER, SF07_COMPOSITE_LOW -> new RootCause(
                    "Generated frames are noisy or unstable between poses.",
                    Confidence.LOW,
                    List.of("Prompt template needs tightening", share));
            case SYS_GENERATOR_TRANSIENT, SYS_GENERATION_FAILED -> new RootCause(
                    "The generator is failing rather than producing poor frames.",
                    Confidence.HIGH,
                    List.of("API key, quota or model configuration", share));
            case HF01_DIMENSION_MISMATCH, HF02_FULLY_TRANSPARENT, HF03_IMAGE_CORRUPTED, HF05_FILE_SIZE_INVALID,
                    HF_IDENTITY_COLLAPSE -> consecutiveOrGeneric(top, stopReason);
        };
    }

    private RootCause consecutiveOrGeneric(FailureTally top, StopReason stopReason) {
        if (stopReason != null && stopReason.condition() == StopCondition.CONSECUTIVE_FAILS) {
            return new RootCause("Systematic issue detected; the model keeps failing on this animation.",
                    Confidence.LOW, List.of("Reference images conflicting",
                    String.format("%.0f consecutive frames failed", stopReason.value())));
        }
        return new RootCause("Primary failure mode: " + top.code() + ". Review the frame audit history.",
                Confidence.LOW, List.of(top.code() + ": " + top.count() + " occurrences"));
    }

    List<RecoveryAction> recoveryActions(List<FailureTally> topFailures, StopReason stopReason) {
        Set<ReasonCode> codes = new LinkedHashSet<>();
        topFailures.forEach(f -> codes.add(f.code()));
        boolean consecutive = stopReason != null && stopReason.condition() == StopCondition.CONSECUTIVE_FAILS;
        return RECOVERY_RULES.stream()
                .filter(rule -> (consecutive && rule.onConsecutiveFails())
                        || rule.appliesTo().stream().anyMatch(codes::contains))
                .map(RecoveryRule::action)
                .sorted(Comparator.comparingInt(RecoveryAction::priority))
                .limit(MAX_RECOVERY_ACTIONS)
                .toList();
    }
}
