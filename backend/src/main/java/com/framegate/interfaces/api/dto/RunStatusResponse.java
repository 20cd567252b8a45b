package com.framegate.interfaces.api.dto;

import com.framegate.domain.frame.model.FrameState;
import com.framegate.domain.frame.model.FrameStatus;
import com.framegate.domain.frame.model.ReasonCode;
import com.framegate.domain.frame.model.ReleaseStatus;
import com.framegate.domain.frame.model.RunState;
import com.framegate.domain.frame.model.RunStatus;
import com.framegate.domain.frame.model.StopReason;

import java.time.Instant;
import java.util.List;

public record RunStatusResponse(
        String runId,
        String moveId,
        RunStatus status,
        boolean active,
        StopReason stopReason,
        ReleaseStatus releaseStatus,
        boolean overrideUsed,
        int totalFrames,
        long framesApproved,
        long framesRejected,
        int totalAttempts,
        double retryRate,
        double rejectRate,
        int consecutiveFails,
        Instant startedAt,
        Instant updatedAt,
        List<FrameSummary> frames
) {

    public record FrameSummary(int index, FrameStatus status, int attempts, ReasonCode finalReason, Double identityScore) {

        static FrameSummary from(FrameState frame) {
            return new FrameSummary(frame.getIndex(), frame.getStatus(), frame.attemptCount(),
                    frame.getFinalReason(), frame.getIdentityScore());
        }
    }

    public static RunStatusResponse from(RunState state, boolean active) {
        return new RunStatusResponse(
                state.getRunId(),
                state.getMoveId(),
                state.getStatus(),
                active,
                state.getStopReason(),
                state.getReleaseStatus(),
                state.isOverrideUsed(),
                state.totalFrames(),
                state.countWithStatus(FrameStatus.APPROVED),
                state.countWithStatus(FrameStatus.REJECTED),
                state.getTotalAttempts(),
                state.getRetryRate(),
                state.getRejectRate(),
                state.getConsecutiveFails(),
                state.getStartedAt(),
                state.getUpdatedAt(),
                state.getFrames().stream().map(FrameSummary::from).toList());
    }
}
