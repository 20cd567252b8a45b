package com.framegate.infrastructure.export;

import com.framegate.domain.frame.model.AtlasValidationReport;
import com.framegate.domain.frame.model.ReleaseStatus;
import com.framegate.domain.frame.model.RunState;
import com.framegate.domain.frame.model.RunStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Release gating. A failed validation blocks release unless an explicit override is given, and
 * the override is recorded on the run.
 */
@Slf4j
@Component
public class ReleaseService {

    public void apply(RunState state, AtlasValidationReport report, boolean override) {
        if (report.passed()) {
            state.setReleaseStatus(ReleaseStatus.RELEASE_READY);
            log.info("[Release] Run {} is release ready", state.getRunId());
            return;
        }
        if (override) {
            state.setReleaseStatus(ReleaseStatus.RELEASE_READY);
            state.setOverrideUsed(true);
            log.warn("[Release] Run {} released with override despite {} failed assertion(s)",
                    state.getRunId(), report.failures().size());
            return;
        }
        state.setReleaseStatus(ReleaseStatus.VALIDATION_FAILED);
        log.warn("[Release] Run {} blocked: {}", state.getRunId(), report.failures());
    }

    /**
     * Promotes a completed run after the fact.
     *
     * @throws IllegalStateException when the run is not releasable
     */
    public void promote(RunState state, boolean override) {
        if (state.getStatus() != RunStatus.COMPLETED || !state.allApproved()) {
            throw new IllegalStateException("Run " + state.getRunId() + " has not completed with every frame approved");
        }
        switch (state.getReleaseStatus()) {
            case RELEASE_READY -> log.info("[Release] Run {} already release ready", state.getRunId());
            case VALIDATION_FAILED -> {
                if (!override) {
                    throw new IllegalStateException("Run " + state.getRunId()
                            + " failed atlas validation; promotion requires an override");
                }
                state.setReleaseStatus(ReleaseStatus.RELEASE_READY);
                state.setOverrideUsed(true);
                log.warn("[Release] Run {} promoted with override", state.getRunId());
            }
            case PENDING -> throw new IllegalStateException("Run " + state.getRunId() + " has not been validated yet");
        }
    }
}
