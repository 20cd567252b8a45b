package com.framegate.infrastructure.pipeline;

import com.framegate.domain.frame.model.FrameState;
import com.framegate.domain.frame.model.FrameStatus;
import com.framegate.domain.frame.model.RunState;
import com.framegate.domain.frame.model.StopCondition;
import com.framegate.domain.frame.model.StopReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Recomputes run aggregates and checks them against the halt thresholds.
 * <p>
 * Rates are fractions of the run's scheduled frame count. Conditions are checked in priority
 * order: circuit breaker, consecutive rejections, reject rate, retry rate.
 * </p>
 */
@Slf4j
@Component
public class StopConditionEvaluator {

    public void refresh(RunState state) {
        int total = state.totalFrames();
        int attempts = 0;
        int withRetries = 0;
        int rejected = 0;
        for (FrameState frame : state.getFrames()) {
            attempts += frame.attemptCount();
            if (frame.getStatus().isTerminal() && frame.hasRetries()) {
                withRetries++;
            }
            if (frame.getStatus() == FrameStatus.REJECTED) {
                rejected++;
            }
        }
        state.setTotalAttempts(attempts);
        // Over the scheduled frame count, not frames attempted: 4 rejects in 8 attempted of 10 is 0.4.
        state.setRetryRate(total == 0 ? 0.0 : (double) withRetries / total);
        state.setRejectRate(total == 0 ? 0.0 : (double) rejected / total);
        state.setConsecutiveFails(trailingRejections(state));
    }

    public Optional<StopReason> evaluate(RunState state, StopConditions conditions) {
        Optional<StopReason> breaker = checkCircuitBreaker(state, conditions);
        if (breaker.isPresent()) {
            return breaker;
        }
        if (state.getConsecutiveFails() > conditions.maxConsecutiveFails()) {
            return Optional.of(new StopReason(StopCondition.CONSECUTIVE_FAILS,
                    state.getConsecutiveFails(), conditions.maxConsecutiveFails(),
                    state.getConsecutiveFails() + " consecutive frames rejected (max "
                            + conditions.maxConsecutiveFails() + ")"));
        }
        if (state.getRejectRate() > conditions.maxRejectRate()) {
            return Optional.of(new StopReason(StopCondition.REJECT_RATE,
                    state.getRejectRate(), conditions.maxRejectRate(),
                    String.format("Reject rate %.2f exceeds %.2f", state.getRejectRate(), conditions.maxRejectRate())));
        }
        if (state.getRetryRate() > conditions.maxRetryRate()) {
            return Optional.of(new StopReason(StopCondition.RETRY_RATE,
                    state.getRetryRate(), conditions.maxRetryRate(),
                    String.format("Retry rate %.2f exceeds %.2f", state.getRetryRate(), conditions.maxRetryRate())));
        }
        return Optional.empty();
    }

    /**
     * Total attempt budget across the run; checked before every new attempt as well as after
     * every finalization.
     */
    public Optional<StopReason> checkCircuitBreaker(RunState state, StopConditions conditions) {
        if (state.getTotalAttempts() >= conditions.circuitBreakerLimit()) {
            log.warn("[StopConditions] Circuit breaker tripped for run {}: {} attempts",
                    state.getRunId(), state.getTotalAttempts());
            return Optional.of(new StopReason(StopCondition.CIRCUIT_BREAKER,
                    state.getTotalAttempts(), conditions.circuitBreakerLimit(),
                    "Total attempts " + state.getTotalAttempts() + " reached the limit of "
                            + conditions.circuitBreakerLimit()));
        }
        return Optional.empty();
    }

    private static int trailingRejections(RunState state) {
        int streak = 0;
        for (FrameState frame : state.getFrames()) {
            if (frame.getStatus() == FrameStatus.REJECTED) {
                streak++;
            } else if (frame.getStatus() == FrameStatus.APPROVED) {
                streak = 0;
            } else {
                break;
            }
        }
        return streak;
    }
}
