package com.framegate.infrastructure.retry;

import com.framegate.domain.frame.model.AttemptRecord;
import com.framegate.domain.frame.model.ReasonCategory;
import com.framegate.domain.frame.model.ReasonCode;
import com.framegate.domain.frame.model.RetryAction;
import com.framegate.domain.frame.model.RetryDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RetryLadderTest {

    private RetryLadder ladder;
    private RetryPolicy policy;

    @BeforeEach
    void setUp() {
        ladder = new RetryLadder();
        policy = RetryPolicy.defaults();
    }

    @Test
    @DisplayName("No reason codes means the frame is accepted")
    void accept() {
        RetryDecision decision = ladder.decide(List.of(), history(RetryAction.INITIAL), policy);

        assertThat(decision.isApproval()).isTrue();
        assertThat(decision.terminal()).isTrue();
        assertThat(decision.primaryReason()).isNull();
    }

    @Test
    @DisplayName("Identical inputs always give identical decisions")
    void deterministic() {
        List<ReasonCode> codes = List.of(ReasonCode.SF06_TEMPORAL_FLICKER, ReasonCode.SF07_COMPOSITE_LOW);
        List<AttemptRecord> history = history(RetryAction.INITIAL, RetryAction.REROLL_SEED);

        RetryDecision first = ladder.decide(codes, history, policy);
        for (int i = 0; i < 20; i++) {
            assertThat(ladder.decide(codes, history, policy)).isEqualTo(first);
        }
        assertThat(first.action()).isEqualTo(RetryAction.TIGHTEN_NEGATIVE);
    }

    @Test
    @DisplayName("Identity drift walks reroll, rescue, then re-anchor")
    void identityLadder() {
        List<ReasonCode> drift = List.of(ReasonCode.SF01_IDENTITY_DRIFT);

        assertThat(ladder.decide(drift, history(RetryAction.INITIAL), policy).action())
                .isEqualTo(RetryAction.REROLL_SEED);
        assertThat(ladder.decide(drift, history(RetryAction.INITIAL, RetryAction.REROLL_SEED), policy).action())
                .isEqualTo(RetryAction.IDENTITY_RESCUE);
        assertThat(ladder.decide(drift,
                history(RetryAction.INITIAL, RetryAction.REROLL_SEED, RetryAction.IDENTITY_RESCUE), policy).action())
                .isEqualTo(RetryAction.RE_ANCHOR);
    }

    @Test
    @DisplayName("Identity drift after two re-anchors collapses the frame")
    void identityCollapse() {
        RetryPolicy roomy = new RetryPolicy(RetryPolicy.DEFAULT_LADDER, 10);
        List<AttemptRecord> history = history(RetryAction.INITIAL, RetryAction.IDENTITY_RESCUE, RetryAction.RE_ANCHOR);

        RetryDecision decision = ladder.decide(List.of(ReasonCode.SF01_IDENTITY_DRIFT), history, roomy);

        assertThat(decision.action()).isEqualTo(RetryAction.REJECT);
        assertThat(decision.primaryReason()).isEqualTo(ReasonCode.HF_IDENTITY_COLLAPSE);
    }

    @Test
    @DisplayName("Halo and noise go to post-processing")
    void postProcess() {
        RetryDecision decision = ladder.decide(List.of(ReasonCode.SF03_ALPHA_HALO), history(RetryAction.INITIAL), policy);

        assertThat(decision.action()).isEqualTo(RetryAction.POST_PROCESS);
        assertThat(decision.terminal()).isFalse();
    }

    @Test
    @DisplayName("Tighten-negative carries its directive as the prompt override")
    void promptOverride() {
        RetryDecision decision = ladder.decide(List.of(ReasonCode.SF02_PALETTE_DRIFT), history(RetryAction.INITIAL), policy);

        assertThat(decision.action()).isEqualTo(RetryAction.TIGHTEN_NEGATIVE);
        assertThat(decision.promptOverride()).isEqualTo(RetryAction.TIGHTEN_NEGATIVE.getPromptDirective());
    }

    @Test
    @DisplayName("Transient failures are retried exactly once, then rejected")
    void transientOnce() {
        List<ReasonCode> transientFailure = List.of(ReasonCode.SYS_GENERATOR_TRANSIENT);

        RetryDecision first = ladder.decide(transientFailure, history(RetryAction.INITIAL), policy);
        RetryDecision second = ladder.decide(transientFailure,
                history(RetryAction.INITIAL, RetryAction.DEFAULT_REGENERATE), policy);

        assertThat(first.action()).isEqualTo(RetryAction.DEFAULT_REGENERATE);
        assertThat(second.action()).isEqualTo(RetryAction.REJECT);
        assertThat(second.primaryReason()).isEqualTo(ReasonCode.SYS_GENERATOR_TRANSIENT);
    }

    @ParameterizedTest
    @EnumSource(value = ReasonCode.class, names = {"HF01_DIMENSION_MISMATCH", "HF02_FULLY_TRANSPARENT",
            "HF04_WRONG_COLOR_DEPTH", "HF05_FILE_SIZE_INVALID", "SYS_GENERATION_FAILED"})
    @DisplayName("Non-transient hard failures are rejected immediately")
    void hardRejects(ReasonCode code) {
        assertThat(code.getCategory()).isNotEqualTo(ReasonCategory.SOFT_FAIL);
        assertThat(code.isTransientFailure()).isFalse();

        RetryDecision decision = ladder.decide(List.of(code), history(RetryAction.INITIAL), policy);

        assertThat(decision.action()).isEqualTo(RetryAction.REJECT);
        assertThat(decision.primaryReason()).isEqualTo(code);
    }

    @Test
    @DisplayName("Hard failures win over soft ones in the same list")
    void hardWins() {
        RetryDecision decision = ladder.decide(
                List.of(ReasonCode.SF01_IDENTITY_DRIFT, ReasonCode.HF02_FULLY_TRANSPARENT),
                history(RetryAction.INITIAL), policy);

        assertThat(decision.primaryReason()).isEqualTo(ReasonCode.HF02_FULLY_TRANSPARENT);
    }

    @Test
    @DisplayName("The per-frame attempt limit rejects the frame")
    void attemptLimit() {
        RetryPolicy two = new RetryPolicy(RetryPolicy.DEFAULT_LADDER, 2);

        RetryDecision decision = ladder.decide(List.of(ReasonCode.SF07_COMPOSITE_LOW),
                history(RetryAction.INITIAL, RetryAction.REROLL_SEED), two);

        assertThat(decision.action()).isEqualTo(RetryAction.REJECT);
        assertThat(decision.rationale()).contains("Attempt limit");
    }

    @Test
    @DisplayName("Disabled ladder steps are skipped")
    void disabledSteps() {
        RetryPolicy noReroll = new RetryPolicy(List.of(RetryAction.TIGHTEN_NEGATIVE, RetryAction.RE_ANCHOR), 5);

        RetryDecision decision = ladder.decide(List.of(ReasonCode.SF06_TEMPORAL_FLICKER), history(RetryAction.INITIAL), noReroll);

        assertThat(decision.action()).isEqualTo(RetryAction.TIGHTEN_NEGATIVE);
    }

    @ParameterizedTest
    @EnumSource(ReasonCode.class)
    @DisplayName("Every soft code has at least one recovery action")
    void softCodesCovered(ReasonCode code) {
        if (code.isSoft()) {
            assertThat(ladder.candidatesFor(code)).isNotEmpty();
        } else {
            assertThat(ladder.candidatesFor(code)).isEmpty();
        }
    }

    private static List<AttemptRecord> history(RetryAction... strategies) {
        List<AttemptRecord> attempts = new ArrayList<>();
        for (int i = 0; i < strategies.length; i++) {
            attempts.add(new AttemptRecord(i + 1, Instant.EPOCH, strategies[i], 1L, "h", null, null,
                    List.of(), null, null));
        }
        return attempts;
    }
}
