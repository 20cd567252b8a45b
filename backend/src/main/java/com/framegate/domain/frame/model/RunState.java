package com.framegate.domain.frame.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable state of one run. Written only by the orchestrator, after every frame transition.
 */
@Data
@NoArgsConstructor
public class RunState {

    private String runId;
    private String moveId;
    private String manifestFingerprint;
    private RunStatus status = RunStatus.IN_PROGRESS;
    private StopReason stopReason;
    private List<FrameState> frames = new ArrayList<>();

    // Aggregates, recomputed after every frame finalization
    private double retryRate;
    private double rejectRate;
    private int consecutiveFails;
    private int totalAttempts;

    private ReleaseStatus releaseStatus = ReleaseStatus.PENDING;
    private boolean overrideUsed;
    private Instant startedAt;
    private Instant updatedAt;

    public static RunState start(String runId, String moveId, String fingerprint, int frameCount, Instant now) {
        RunState state = new RunState();
        state.setRunId(runId);
        state.setMoveId(moveId);
        state.setManifestFingerprint(fingerprint);
        state.setStartedAt(now);
        state.setUpdatedAt(now);
        for (int i = 0; i < frameCount; i++) {
            state.getFrames().add(new FrameState(i));
        }
        return state;
    }

    public FrameState frame(int index) {
        return frames.get(index);
    }

    public int totalFrames() {
        return frames.size();
    }

    /** Index of the first frame that is not yet approved or rejected, or -1. */
    public int firstNonTerminalIndex() {
        for (FrameState frame : frames) {
            if (!frame.getStatus().isTerminal()) {
                return frame.getIndex();
            }
        }
        return -1;
    }

    public long countWithStatus(FrameStatus status) {
        return frames.stream().filter(f -> f.getStatus() == status).count();
    }

    public boolean allApproved() {
        return !frames.isEmpty() && frames.stream().allMatch(f -> f.getStatus() == FrameStatus.APPROVED);
    }
}
