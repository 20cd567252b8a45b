package com.framegate.application.run;

import com.framegate.application.run.exception.RunNotFoundException;
import com.framegate.domain.frame.exception.ConfigException;
import com.framegate.domain.frame.model.RunManifest;
import com.framegate.domain.frame.model.RunState;
import com.framegate.infrastructure.config.FrameGateProperties;
import com.framegate.infrastructure.config.PipelineSettingsFactory;
import com.framegate.infrastructure.export.ReleaseService;
import com.framegate.infrastructure.persistence.RunStateStore;
import com.framegate.infrastructure.persistence.RunWorkspace;
import com.framegate.infrastructure.pipeline.CancellationToken;
import com.framegate.infrastructure.pipeline.RunOrchestrator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RunAppServiceTest {

    @Mock
    private RunOrchestrator orchestrator;
    @Mock
    private PipelineSettingsFactory settingsFactory;
    @Mock
    private RunStateStore stateStore;
    @Mock
    private ReleaseService releaseService;

    @TempDir
    Path tempDir;

    private RunAppService service;
    private Path anchorPath;

    @BeforeEach
    void setUp() throws IOException {
        FrameGateProperties properties = new FrameGateProperties();
        properties.getStorage().setRunsDir(tempDir.resolve("runs").toString());
        service = new RunAppService(orchestrator, settingsFactory, stateStore, releaseService, properties);
        anchorPath = Files.write(tempDir.resolve("anchor.png"), new byte[]{1});
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    @DisplayName("Starting a run executes it in the background with the resolved settings")
    void startRunsInBackground() {
        RunManifest manifest = manifest(anchorPath.toString());

        String runId = service.start(manifest, true);

        assertThat(runId).isEqualTo("run_1");
        verify(orchestrator, timeout(2000)).execute(eq(manifest), any(), eq(workspace()), eq(true),
                any(CancellationToken.class));
    }

    @Test
    @DisplayName("A missing anchor is refused before anything is scheduled")
    void missingAnchor() {
        assertThatThrownBy(() -> service.start(manifest(tempDir.resolve("nope.png").toString()), false))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Anchor image not found");
        verify(orchestrator, never()).execute(any(), any(), any(), anyBoolean(), any());
    }

    @Test
    @DisplayName("The same run cannot be started twice while active, and cancelling reaches its token")
    void singleActiveRun() throws InterruptedException {
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch cancelled = new CountDownLatch(1);
        when(orchestrator.execute(any(), any(), any(), anyBoolean(), any())).thenAnswer(invocation -> {
            CancellationToken token = invocation.getArgument(4);
            running.countDown();
            token.sleep(Duration.ofSeconds(5));
            if (token.isCancelled()) {
                cancelled.countDown();
            }
            return new RunState();
        });
        RunManifest manifest = manifest(anchorPath.toString());

        service.start(manifest, false);
        assertThat(running.await(2, TimeUnit.SECONDS)).isTrue();

        assertThat(service.isActive("run_1")).isTrue();
        assertThatThrownBy(() -> service.start(manifest, false))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already in progress");
        assertThatThrownBy(() -> service.release("run_1", false))
                .isInstanceOf(IllegalStateException.class);

        service.cancel("run_1");
        assertThat(cancelled.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Unknown runs are reported as not found")
    void unknownRun() {
        when(stateStore.load(workspace())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.status("run_1")).isInstanceOf(RunNotFoundException.class);
        assertThatThrownBy(() -> service.cancel("run_1")).isInstanceOf(RunNotFoundException.class);
        assertThatThrownBy(() -> service.diagnostic("run_1")).isInstanceOf(RunNotFoundException.class);
    }

    @Test
    @DisplayName("A run without a diagnostic report is an invalid state")
    void missingDiagnostic() {
        when(stateStore.load(workspace())).thenReturn(Optional.of(new RunState()));

        assertThatThrownBy(() -> service.diagnostic("run_1"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no diagnostic report");
    }

    @Test
    @DisplayName("Release promotes the persisted run and saves it")
    void release() {
        RunState state = RunState.start("run_1", "idle", "fp", 1, Instant.EPOCH);
        when(stateStore.load(workspace())).thenReturn(Optional.of(state));

        RunState released = service.release("run_1", true);

        assertThat(released).isSameAs(state);
        verify(releaseService).promote(state, true);
        verify(stateStore).save(workspace(), state);
    }

    private RunWorkspace workspace() {
        return RunWorkspace.of(tempDir.resolve("runs"), "run_1");
    }

    private static RunManifest manifest(String anchorPath) {
        return new RunManifest("run_1", "knight", "idle", "idle", 4, true, anchorPath, List.of(), null);
    }
}
