package com.framegate.domain.frame.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class FrameState {

    private int index;
    private FrameStatus status = FrameStatus.PENDING;
    private List<AttemptRecord> attempts = new ArrayList<>();
    private ReasonCode finalReason;
    private String rejectionNote;
    private Double identityScore;
    private String approvedPath;

    public FrameState(int index) {
        this.index = index;
    }

    public void transitionTo(FrameStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Frame " + index + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    /**
     * Rewinds a frame that was mid-attempt when the process died. The in-flight attempt was never
     * persisted, so the frame resumes from its last recorded decision point.
     */
    public void recoverInFlight() {
        if (status.isTerminal() || status == FrameStatus.PENDING) {
            return;
        }
        status = attempts.isEmpty() ? FrameStatus.PENDING : FrameStatus.RETRY_DECIDING;
    }

    public int attemptCount() {
        return attempts.size();
    }

    public AttemptRecord lastAttempt() {
        return attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);
    }

    public void replaceLastAttempt(AttemptRecord attempt) {
        attempts.set(attempts.size() - 1, attempt);
    }

    public boolean hasRetries() {
        return attempts.size() > 1;
    }
}
