package com.framegate.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.framegate.domain.frame.exception.StateStoreException;
import com.framegate.domain.frame.model.AttemptRecord;
import com.framegate.domain.frame.model.FrameStatus;
import com.framegate.domain.frame.model.ReasonCode;
import com.framegate.domain.frame.model.RetryAction;
import com.framegate.domain.frame.model.RunState;
import com.framegate.domain.frame.model.RunStatus;
import com.framegate.domain.frame.model.StopCondition;
import com.framegate.domain.frame.model.StopReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunStateStoreTest {

    @TempDir
    Path runsDir;

    private RunStateStore store;
    private RunWorkspace workspace;

    @BeforeEach
    void setUp() {
        store = new RunStateStore(new ObjectMapper().findAndRegisterModules());
        workspace = RunWorkspace.of(runsDir, "run_1");
    }

    @Test
    @DisplayName("Saved state loads back with frames, attempts and stop reason intact")
    void roundTrip() {
        RunState state = RunState.start("run_1", "idle", "abc123", 3, Instant.parse("2026-01-01T00:00:00Z"));
        state.frame(0).getAttempts().add(new AttemptRecord(1, Instant.parse("2026-01-01T00:00:05Z"),
                RetryAction.INITIAL, 99L, "deadbeef", 0.81, 0.9,
                List.of(ReasonCode.SF04_BASELINE_DRIFT), RetryAction.REROLL_SEED, "candidates/frame_0000_attempt_01.png"));
        state.frame(0).setStatus(FrameStatus.RETRY_DECIDING);
        state.setStatus(RunStatus.STOPPED);
        state.setStopReason(new StopReason(StopCondition.REJECT_RATE, 0.4, 0.3, "too many"));

        store.save(workspace, state);
        RunState loaded = store.load(workspace).orElseThrow();

        assertThat(loaded).isEqualTo(state);
        assertThat(loaded.frame(0).lastAttempt().decision()).isEqualTo(RetryAction.REROLL_SEED);
    }

    @Test
    @DisplayName("Loading a run that was never saved is empty")
    void missingState() {
        assertThat(store.load(workspace)).isEmpty();
    }

    @Test
    @DisplayName("Atomic writes replace the target and leave no temp files behind")
    void atomicWriteLeavesNoTempFile() throws IOException {
        Path target = workspace.approvedPath("idle", 0);

        store.writeAtomically(target, new byte[]{1, 2, 3});
        store.writeAtomically(target, new byte[]{4, 5});

        assertThat(Files.readAllBytes(target)).containsExactly(4, 5);
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("0000.png");
        }
    }

    @Test
    @DisplayName("Corrupt state surfaces as a state store failure")
    void corruptState() throws IOException {
        Files.createDirectories(workspace.root());
        Files.writeString(workspace.statePath(), "{not json");

        assertThatThrownBy(() -> store.load(workspace)).isInstanceOf(StateStoreException.class);
    }
}
