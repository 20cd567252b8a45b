package com.framegate.infrastructure.retry;

import com.framegate.domain.frame.model.AttemptRecord;
import com.framegate.domain.frame.model.ReasonCode;
import com.framegate.domain.frame.model.RetryAction;
import com.framegate.domain.frame.model.RetryDecision;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides what happens to a frame after an audit.
 * <p>
 * A pure function of the reason codes, the frame's attempt history and the policy: identical
 * inputs always give identical decisions. The history must include the attempt that produced
 * {@code reasonCodes}.
 * </p>
 */
@Component
public class RetryLadder {

    static final int MAX_RE_ANCHORS = 2;

    public RetryDecision decide(List<ReasonCode> reasonCodes, List<AttemptRecord> history, RetryPolicy policy) {
        if (reasonCodes.isEmpty()) {
            return RetryDecision.accept();
        }

        // Hard and system failures bypass the ladder
        Optional<ReasonCode> hard = reasonCodes.stream().filter(code -> !code.isSoft()).findFirst();
        if (hard.isPresent()) {
            return decideHard(hard.get(), history, policy);
        }

        int reAnchors = countReAnchors(history);
        if (reasonCodes.contains(ReasonCode.SF01_IDENTITY_DRIFT) && reAnchors >= MAX_RE_ANCHORS) {
            return RetryDecision.reject(ReasonCode.HF_IDENTITY_COLLAPSE,
                    "Identity below threshold after " + reAnchors + " re-anchors");
        }

        ReasonCode primary = reasonCodes.get(0);
        if (history.size() >= policy.maxAttemptsPerFrame()) {
            return RetryDecision.reject(primary,
                    "Attempt limit " + policy.maxAttemptsPerFrame() + " reached");
        }

        Set<RetryAction> used = usedActions(history);
        Optional<RetryAction> next = candidatesFor(primary).stream()
                .filter(policy::enabled)
                .filter(action -> !used.contains(action))
                .min(Comparator.comparingInt(policy.ladderOrder()::indexOf));
        if (next.isPresent()) {
            return RetryDecision.retry(next.get(), primary, primary + " -> " + next.get());
        }

        if (policy.enabled(RetryAction.RE_ANCHOR) && reAnchors < MAX_RE_ANCHORS) {
            return RetryDecision.retry(RetryAction.RE_ANCHOR, primary,
                    primary + " ladder exhausted, escalating to re-anchor");
        }
        return RetryDecision.reject(primary, "Retry ladder exhausted for " + primary);
    }

    /**
     * Recovery actions for a soft failure, before policy filtering.
     */
    public List<RetryAction> candidatesFor(ReasonCode code) {
        return switch (code) {
            case SF01_IDENTITY_DRIFT -> List.of(RetryAction.REROLL_SEED, RetryAction.IDENTITY_RESCUE, RetryAction.RE_ANCHOR);
            case SF02_PALETTE_DRIFT -> List.of(RetryAction.TIGHTEN_NEGATIVE, RetryAction.IDENTITY_RESCUE);
            case SF03_ALPHA_HALO, SF05_PIXEL_NOISE, SF_FRINGE_RISK -> List.of(RetryAction.POST_PROCESS);
            case SF04_BASELINE_DRIFT -> List.of(RetryAction.POSE_RESCUE, RetryAction.RE_ANCHOR);
            case SF06_TEMPORAL_FLICKER, SF07_COMPOSITE_LOW -> List.of(RetryAction.REROLL_SEED, RetryAction.TIGHTEN_NEGATIVE);
            case HF01_DIMENSION_MISMATCH, HF02_FULLY_TRANSPARENT, HF03_IMAGE_CORRUPTED, HF04_WRONG_COLOR_DEPTH,
                    HF05_FILE_SIZE_INVALID, HF_IDENTITY_COLLAPSE, SYS_GENERATOR_TRANSIENT, SYS_GENERATION_FAILED -> List.of();
        };
    }

    private RetryDecision decideHard(ReasonCode code, List<AttemptRecord> history, RetryPolicy policy) {
        boolean transientRetryUsed = history.stream().anyMatch(a -> a.strategy() == RetryAction.DEFAULT_REGENERATE);
        if (code.isTransientFailure() && !transientRetryUsed && history.size() < policy.maxAttemptsPerFrame()) {
            return RetryDecision.retry(RetryAction.DEFAULT_REGENERATE, code, code + " is transient, retrying once");
        }
        return RetryDecision.reject(code, code.getDescription());
    }

    private static int countReAnchors(List<AttemptRecord> history) {
        return (int) history.stream().filter(a -> a.strategy() != null && a.strategy().isReAnchor()).count();
    }

    private static Set<RetryAction> usedActions(List<AttemptRecord> history) {
        Set<RetryAction> used = EnumSet.noneOf(RetryAction.class);
        history.stream().map(AttemptRecord::strategy).filter(s -> s != null).forEach(used::add);
        return used;
    }
}
