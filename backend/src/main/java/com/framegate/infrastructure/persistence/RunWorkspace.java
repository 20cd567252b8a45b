package com.framegate.infrastructure.persistence;

import com.framegate.infrastructure.export.FrameNaming;

import java.nio.file.Path;

/**
 * File layout of one run directory.
 */
public record RunWorkspace(Path root) {

    public static RunWorkspace of(Path runsDir, String runId) {
        return new RunWorkspace(runsDir.resolve(runId));
    }

    public Path statePath() {
        return root.resolve("state.json");
    }

    public Path diagnosticPath() {
        return root.resolve("diagnostic.json");
    }

    public Path summaryPath() {
        return root.resolve("summary.json");
    }

    public Path frameMetricsPath(int frameIndex) {
        return root.resolve("audit").resolve(String.format("frame_%04d_metrics.json", frameIndex));
    }

    public Path candidatePath(int frameIndex, int attemptIndex) {
        return root.resolve("candidates").resolve(String.format("frame_%04d_attempt_%02d.png", frameIndex, attemptIndex));
    }

    public Path approvedPath(String moveId, int frameIndex) {
        return root.resolve("approved").resolve(FrameNaming.frameKey(moveId, frameIndex) + ".png");
    }

    public Path atlasImagePath() {
        return root.resolve("export").resolve("atlas.png");
    }

    public Path atlasDataPath() {
        return root.resolve("export").resolve("atlas.json");
    }

    public Path validationPath() {
        return root.resolve("export").resolve("validation.json");
    }
}
