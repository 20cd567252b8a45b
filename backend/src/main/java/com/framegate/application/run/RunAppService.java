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
import com.framegate.infrastructure.pipeline.DiagnosticReport;
import com.framegate.infrastructure.pipeline.PipelineSettings;
import com.framegate.infrastructure.pipeline.RunOrchestrator;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Starts, observes and cancels runs. Each run executes on its own single worker thread; a runId
 * can only be active once at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunAppService {

    private final RunOrchestrator orchestrator;
    private final PipelineSettingsFactory settingsFactory;
    private final RunStateStore stateStore;
    private final ReleaseService releaseService;
    private final FrameGateProperties properties;

    private final Map<String, ActiveRun> activeRuns = new ConcurrentHashMap<>();

    /**
     * Validates the manifest and settings, then runs (or resumes) the run in the background.
     *
     * @return the run id
     * @throws ConfigException       on invalid manifest or settings
     * @throws IllegalStateException when the run is already executing
     */
    public String start(RunManifest manifest, boolean overrideFingerprint) {
        PipelineSettings settings = settingsFactory.resolve(manifest);
        if (!Files.isRegularFile(Path.of(manifest.anchorPath()))) {
            throw new ConfigException("Anchor image not found: " + manifest.anchorPath());
        }

        String runId = manifest.runId();
        RunWorkspace workspace = workspace(runId);
        CancellationToken token = new CancellationToken();
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> new Thread(r, "run-" + runId));
        ActiveRun active = new ActiveRun(token, executor);
        if (activeRuns.putIfAbsent(runId, active) != null) {
            executor.shutdown();
            throw new IllegalStateException("Run " + runId + " is already in progress");
        }

        executor.submit(() -> {
            try {
                RunState state = orchestrator.execute(manifest, settings, workspace, overrideFingerprint, token);
                log.info("[RunAppService] Run {} finished with status {}", runId, state.getStatus());
            } catch (RuntimeException e) {
                log.error("[RunAppService] Run {} terminated with an error", runId, e);
            } finally {
                activeRuns.remove(runId, active);
                executor.shutdown();
            }
        });
        log.info("[RunAppService] Run {} submitted ({} frames, move {})", runId, manifest.frameCount(), manifest.moveId());
        return runId;
    }

    public RunState status(String runId) {
        return stateStore.load(workspace(runId))
                .orElseThrow(() -> new RunNotFoundException(runId));
    }

    public boolean isActive(String runId) {
        return activeRuns.containsKey(runId);
    }

    /**
     * Requests cooperative cancellation. The run persists its state with a user-interrupt stop
     * reason at the next checkpoint.
     */
    public void cancel(String runId) {
        ActiveRun active = activeRuns.get(runId);
        if (active == null) {
            throw new RunNotFoundException(runId);
        }
        active.token().cancel();
        log.info("[RunAppService] Cancellation requested for run {}", runId);
    }

    public DiagnosticReport diagnostic(String runId) {
        RunWorkspace workspace = workspace(runId);
        if (stateStore.load(workspace).isEmpty()) {
            throw new RunNotFoundException(runId);
        }
        Path path = workspace.diagnosticPath();
        if (!Files.exists(path)) {
            throw new IllegalStateException("Run " + runId + " has no diagnostic report");
        }
        return stateStore.read(path, DiagnosticReport.class);
    }

    /**
     * Promotes a completed run to release ready.
     *
     * @param override release even though atlas validation failed
     */
    public RunState release(String runId, boolean override) {
        if (isActive(runId)) {
            throw new IllegalStateException("Run " + runId + " is still in progress");
        }
        RunWorkspace workspace = workspace(runId);
        RunState state = stateStore.load(workspace)
                .orElseThrow(() -> new RunNotFoundException(runId));
        releaseService.promote(state, override);
        stateStore.save(workspace, state);
        return state;
    }

    @PreDestroy
    public void shutdown() {
        activeRuns.forEach((runId, active) -> {
            log.info("[RunAppService] Interrupting run {} on shutdown", runId);
            active.token().cancel();
            active.executor().shutdown();
        });
    }

    private RunWorkspace workspace(String runId) {
        return RunWorkspace.of(Path.of(properties.getStorage().getRunsDir()), runId);
    }

    private record ActiveRun(CancellationToken token, ExecutorService executor) {
    }
}
