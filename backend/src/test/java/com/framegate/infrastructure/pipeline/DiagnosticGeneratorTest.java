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
import com.framegate.infrastructure.pipeline.DiagnosticReport.RecoveryAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticGeneratorTest {

    private final DiagnosticGenerator generator = new DiagnosticGenerator();
    private final Instant now = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    @DisplayName("Summarizes a run stopped on reject rate by generator failures")
    void generatorFailureReport() {
        RunState state = RunState.start("run_c", "idle", "fp", 10, now);
        for (int i = 0; i < 8; i++) {
            boolean failed = i % 2 == 1;
            record(state.frame(i), failed ? FrameStatus.REJECTED : FrameStatus.APPROVED,
                    failed ? List.of(ReasonCode.SYS_GENERATION_FAILED) : List.of());
        }
        state.setTotalAttempts(8);
        StopReason stop = new StopReason(StopCondition.REJECT_RATE, 0.4, 0.3, "Reject rate 0.40 exceeds 0.30");

        DiagnosticReport report = generator.generate(state, stop, now);

        assertThat(report.runId()).isEqualTo("run_c");
        assertThat(report.stopCondition().type()).isEqualTo(StopCondition.REJECT_RATE);
        assertThat(report.stopCondition().actualValue()).isEqualTo(0.4);
        assertThat(report.summary().framesAttempted()).isEqualTo(8);
        assertThat(report.summary().framesApproved()).isEqualTo(4);
        assertThat(report.summary().framesRejected()).isEqualTo(4);
        assertThat(report.summary().averageAttemptsPerFrame()).isEqualTo(1.0);
        assertThat(report.frameBreakdown()).hasSize(10);

        FailureTally top = report.topFailures().get(0);
        assertThat(top.code()).isEqualTo(ReasonCode.SYS_GENERATION_FAILED);
        assertThat(top.count()).isEqualTo(4);
        assertThat(top.percentage()).isEqualTo(100.0);
        assertThat(top.exampleFrames()).containsExactly(1, 3, 5);

        assertThat(report.rootCause().confidence()).isEqualTo(Confidence.HIGH);
        assertThat(report.recoveryActions()).extracting(RecoveryAction::action)
                .containsExactly("Check generator availability");
    }

    @Test
    @DisplayName("Top failures are ordered by count and capped at three")
    void topFailuresOrdering() {
        RunState state = RunState.start("run_d", "walk", "fp", 4, now);
        record(state.frame(0), FrameStatus.REJECTED, List.of(ReasonCode.SF01_IDENTITY_DRIFT, ReasonCode.SF02_PALETTE_DRIFT));
        record(state.frame(1), FrameStatus.REJECTED, List.of(ReasonCode.SF01_IDENTITY_DRIFT, ReasonCode.SF05_PIXEL_NOISE));
        record(state.frame(2), FrameStatus.REJECTED, List.of(ReasonCode.SF01_IDENTITY_DRIFT, ReasonCode.SF03_ALPHA_HALO));
        record(state.frame(3), FrameStatus.REJECTED, List.of(ReasonCode.SF02_PALETTE_DRIFT));

        DiagnosticReport report = generator.generate(state, null, now);

        assertThat(report.stopCondition()).isNull();
        assertThat(report.topFailures()).extracting(FailureTally::code)
                .containsExactly(ReasonCode.SF01_IDENTITY_DRIFT, ReasonCode.SF02_PALETTE_DRIFT, ReasonCode.SF03_ALPHA_HALO);
        assertThat(report.rootCause().confidence()).isEqualTo(Confidence.MEDIUM);
        assertThat(report.recoveryActions()).hasSizeLessThanOrEqualTo(4)
                .extracting(RecoveryAction::priority).isSorted();
    }

    @Test
    @DisplayName("Identity collapse dominates the root cause")
    void identityCollapseRootCause() {
        List<FailureTally> tallies = List.of(
                new FailureTally(ReasonCode.SF01_IDENTITY_DRIFT, 5, 70.0, List.of(1)),
                new FailureTally(ReasonCode.HF_IDENTITY_COLLAPSE, 2, 30.0, List.of(2)));

        assertThat(generator.rootCause(tallies, null).confidence()).isEqualTo(Confidence.HIGH);
        assertThat(generator.rootCause(tallies, null).suggestion()).contains("Identity collapse");
    }

    @Test
    @DisplayName("Consecutive failures add the simplify-animation action")
    void consecutiveFailuresAction() {
        StopReason stop = new StopReason(StopCondition.CONSECUTIVE_FAILS, 6, 5, "6 consecutive frames rejected");

        List<RecoveryAction> actions = generator.recoveryActions(List.of(), stop);

        assertThat(actions).extracting(RecoveryAction::action).containsExactly("Simplify animation");
    }

    @Test
    @DisplayName("A user interrupt without failures is reported as such")
    void userInterrupt() {
        RunState state = RunState.start("run_e", "idle", "fp", 3, now);
        StopReason stop = new StopReason(StopCondition.USER_INTERRUPT, 0, 0, "Cancelled");

        DiagnosticReport report = generator.generate(state, stop, now);

        assertThat(report.topFailures()).isEmpty();
        assertThat(report.rootCause().suggestion()).contains("interrupted");
        assertThat(report.summary().averageAttemptsPerFrame()).isZero();
    }

    private static void record(FrameState frame, FrameStatus status, List<ReasonCode> codes) {
        frame.getAttempts().add(new AttemptRecord(0, Instant.EPOCH, RetryAction.INITIAL, 1L, "hash",
                codes.isEmpty() ? 0.9 : null, null, codes,
                codes.isEmpty() ? RetryAction.ACCEPT : RetryAction.REJECT, null));
        frame.setStatus(status);
    }
}
