package com.framegate.infrastructure.pipeline;

import com.framegate.domain.frame.model.AttemptRecord;
import com.framegate.domain.frame.model.FrameState;
import com.framegate.domain.frame.model.FrameStatus;
import com.framegate.domain.frame.model.RetryAction;
import com.framegate.domain.frame.model.RunState;
import com.framegate.domain.frame.model.StopCondition;
import com.framegate.domain.frame.model.StopReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class StopConditionEvaluatorTest {

    private final StopConditionEvaluator evaluator = new StopConditionEvaluator();
    private final StopConditions defaults = StopConditions.defaults();

    @Test
    @DisplayName("Rates use the scheduled frame count as denominator")
    void ratesUseScheduledFrames() {
        RunState state = run(10);
        finish(state.frame(0), FrameStatus.APPROVED, 1);
        finish(state.frame(1), FrameStatus.REJECTED, 1);
        finish(state.frame(2), FrameStatus.APPROVED, 3);

        evaluator.refresh(state);

        assertThat(state.getTotalAttempts()).isEqualTo(5);
        assertThat(state.getRejectRate()).isEqualTo(0.1);
        assertThat(state.getRetryRate()).isEqualTo(0.1);
        assertThat(state.getConsecutiveFails()).isZero();
    }

    @Test
    @DisplayName("Four rejections out of ten stop the run on reject rate")
    void rejectRateStopsRun() {
        RunState state = run(10);
        for (int i = 0; i < 8; i++) {
            finish(state.frame(i), i % 2 == 1 ? FrameStatus.REJECTED : FrameStatus.APPROVED, 1);
        }

        evaluator.refresh(state);
        Optional<StopReason> reason = evaluator.evaluate(state, defaults);

        assertThat(reason).isPresent();
        assertThat(reason.get().condition()).isEqualTo(StopCondition.REJECT_RATE);
        assertThat(reason.get().value()).isEqualTo(0.4);
        assertThat(reason.get().threshold()).isEqualTo(0.30);
    }

    @Test
    @DisplayName("Three rejections out of ten do not stop the run")
    void rejectRateAtThresholdContinues() {
        RunState state = run(10);
        finish(state.frame(0), FrameStatus.REJECTED, 1);
        finish(state.frame(1), FrameStatus.APPROVED, 1);
        finish(state.frame(2), FrameStatus.REJECTED, 1);
        finish(state.frame(3), FrameStatus.REJECTED, 1);

        evaluator.refresh(state);

        assertThat(state.getRejectRate()).isEqualTo(0.3);
        assertThat(evaluator.evaluate(state, defaults)).isEmpty();
    }

    @Test
    @DisplayName("Consecutive rejections count the trailing streak and reset on approval")
    void consecutiveFailsIsTrailingStreak() {
        RunState state = run(100);
        finish(state.frame(0), FrameStatus.REJECTED, 1);
        finish(state.frame(1), FrameStatus.REJECTED, 1);
        finish(state.frame(2), FrameStatus.APPROVED, 1);
        for (int i = 3; i < 9; i++) {
            finish(state.frame(i), FrameStatus.REJECTED, 1);
        }

        evaluator.refresh(state);
        Optional<StopReason> reason = evaluator.evaluate(state, defaults);

        assertThat(state.getConsecutiveFails()).isEqualTo(6);
        assertThat(reason).map(StopReason::condition).contains(StopCondition.CONSECUTIVE_FAILS);
    }

    @Test
    @DisplayName("Retry rate counts only finalized frames that needed more than one attempt")
    void retryRateStopsRun() {
        RunState state = run(4);
        finish(state.frame(0), FrameStatus.APPROVED, 2);
        finish(state.frame(1), FrameStatus.APPROVED, 3);
        finish(state.frame(2), FrameStatus.APPROVED, 2);
        state.frame(3).setStatus(FrameStatus.RETRY_DECIDING);
        state.frame(3).getAttempts().addAll(List.of(attempt(0), attempt(1)));

        evaluator.refresh(state);
        Optional<StopReason> reason = evaluator.evaluate(state, defaults);

        assertThat(state.getRetryRate()).isEqualTo(0.75);
        assertThat(reason).map(StopReason::condition).contains(StopCondition.RETRY_RATE);
    }

    @Test
    @DisplayName("Circuit breaker takes priority over every other condition")
    void circuitBreakerHasPriority() {
        RunState state = run(2);
        finish(state.frame(0), FrameStatus.REJECTED, 3);
        finish(state.frame(1), FrameStatus.REJECTED, 3);
        StopConditions tight = new StopConditions(0.5, 0.3, 0, 6);

        evaluator.refresh(state);
        Optional<StopReason> reason = evaluator.evaluate(state, tight);

        assertThat(reason).map(StopReason::condition).contains(StopCondition.CIRCUIT_BREAKER);
        assertThat(reason.get().value()).isEqualTo(6.0);
    }

    @Test
    @DisplayName("Circuit breaker stays quiet below the attempt budget")
    void circuitBreakerBelowLimit() {
        RunState state = run(2);
        finish(state.frame(0), FrameStatus.APPROVED, 49);

        evaluator.refresh(state);

        assertThat(evaluator.checkCircuitBreaker(state, defaults)).isEmpty();
    }

    private static RunState run(int frames) {
        return RunState.start("run_1", "idle", "fp", frames, Instant.EPOCH);
    }

    private static void finish(FrameState frame, FrameStatus status, int attempts) {
        for (int i = 0; i < attempts; i++) {
            frame.getAttempts().add(attempt(i));
        }
        frame.setStatus(status);
    }

    private static AttemptRecord attempt(int index) {
        return new AttemptRecord(index, Instant.EPOCH, RetryAction.INITIAL, 1L, "hash",
                null, null, List.of(), RetryAction.ACCEPT, null);
    }
}
