package com.framegate.infrastructure.pipeline;

import com.framegate.domain.frame.exception.ConfigException;
import com.framegate.domain.frame.exception.GenerationException;
import com.framegate.domain.frame.exception.GenerationFailure;
import com.framegate.domain.frame.exception.ResumeConflictException;
import com.framegate.domain.frame.exception.StateStoreException;
import com.framegate.domain.frame.model.AlignmentResult;
import com.framegate.domain.frame.model.AttemptRecord;
import com.framegate.domain.frame.model.AuditResult;
import com.framegate.domain.frame.model.CandidateResult;
import com.framegate.domain.frame.model.FrameCandidate;
import com.framegate.domain.frame.model.FrameState;
import com.framegate.domain.frame.model.FrameStatus;
import com.framegate.domain.frame.model.GenerationRequest;
import com.framegate.domain.frame.model.Metric;
import com.framegate.domain.frame.model.NormalizedFrame;
import com.framegate.domain.frame.model.PixelBuffer;
import com.framegate.domain.frame.model.ReasonCode;
import com.framegate.domain.frame.model.ReferenceImage;
import com.framegate.domain.frame.model.RetryAction;
import com.framegate.domain.frame.model.RetryDecision;
import com.framegate.domain.frame.model.RunManifest;
import com.framegate.domain.frame.model.RunState;
import com.framegate.domain.frame.model.RunStatus;
import com.framegate.domain.frame.model.StopCondition;
import com.framegate.domain.frame.model.StopReason;
import com.framegate.domain.frame.service.GeneratorAdapter;
import com.framegate.infrastructure.audit.AuditContext;
import com.framegate.infrastructure.audit.QualityAuditor;
import com.framegate.infrastructure.audit.metrics.PaletteFidelityCalculator;
import com.framegate.infrastructure.export.AtlasExportService;
import com.framegate.infrastructure.imaging.AnchorAnalysis;
import com.framegate.infrastructure.imaging.AnchorAnalyzer;
import com.framegate.infrastructure.imaging.AnchorReference;
import com.framegate.infrastructure.imaging.ColorMath;
import com.framegate.infrastructure.imaging.DecodedImage;
import com.framegate.infrastructure.imaging.Downsampler;
import com.framegate.infrastructure.imaging.FrameNormalizer;
import com.framegate.infrastructure.imaging.ImageCodec;
import com.framegate.infrastructure.persistence.RunStateStore;
import com.framegate.infrastructure.persistence.RunWorkspace;
import com.framegate.infrastructure.retry.PostProcessor;
import com.framegate.infrastructure.retry.RetryLadder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Drives a run frame by frame:
 * <p>
 * generate → normalize → audit → decide (→ retry) → approve | reject
 * </p>
 * Frames are processed strictly in order. The run state is persisted after every frame
 * transition, so a crashed or interrupted run resumes from the first non-terminal frame.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunOrchestrator {

    private static final int PALETTE_EXTRACTION_LIMIT = 256;

    private final GeneratorAdapter generator;
    private final FrameNormalizer normalizer;
    private final QualityAuditor auditor;
    private final RetryLadder retryLadder;
    private final PostProcessor postProcessor;
    private final StopConditionEvaluator stopEvaluator;
    private final DiagnosticGenerator diagnosticGenerator;
    private final RunSummaryGenerator summaryGenerator;
    private final ReferenceChainResolver chainResolver;
    private final PromptBuilder promptBuilder;
    private final SeedPolicy seedPolicy;
    private final ManifestFingerprint manifestFingerprint;
    private final AnchorAnalyzer anchorAnalyzer;
    private final Downsampler downsampler;
    private final PaletteFidelityCalculator paletteCalculator;
    private final ImageCodec imageCodec;
    private final RunStateStore stateStore;
    private final AtlasExportService exportService;
    private final Clock clock;

    /**
     * Run (or resume) every frame of the manifest.
     *
     * @param overrideFingerprint adopt a persisted state whose fingerprint differs from the current one
     * @return the final persisted state
     * @throws ConfigException         when the configuration or anchor is unusable; no frame is attempted
     * @throws ResumeConflictException when persisted state belongs to a different configuration
     */
    public RunState execute(RunManifest manifest,
                            PipelineSettings settings,
                            RunWorkspace workspace,
                            boolean overrideFingerprint,
                            CancellationToken token) {
        RunContext ctx = new RunContext();
        ctx.setManifest(manifest);
        ctx.setSettings(settings);
        ctx.setWorkspace(workspace);
        ctx.setOverrideFingerprint(overrideFingerprint);
        ctx.setToken(token);

        // 1. Anchor, palette, fingerprint, persisted state
        prepare(ctx);

        try {
            // 2. Frames in order
            for (FrameState frame : ctx.getState().getFrames()) {
                if (frame.getStatus().isTerminal()) {
                    continue;
                }
                if (token.isCancelled()) {
                    return interrupt(ctx);
                }

                Optional<StopReason> halted = processFrame(ctx, frame);
                if (halted.isPresent()) {
                    return stopRun(ctx, halted.get());
                }

                stopEvaluator.refresh(ctx.getState());
                persist(ctx);
                if (ctx.getState().firstNonTerminalIndex() < 0) {
                    break;
                }
                Optional<StopReason> stop = stopEvaluator.evaluate(ctx.getState(), settings.stopConditions());
                if (stop.isPresent()) {
                    return stopRun(ctx, stop.get());
                }
            }

            // 3. Completion and packaging
            return finish(ctx);
        } catch (RuntimeException e) {
            markFailed(ctx, e);
            throw e;
        }
    }

    // ===== Preparation =====

    void prepare(RunContext ctx) {
        RunManifest manifest = ctx.getManifest();
        PipelineSettings settings = ctx.getSettings();
        int generationSize = settings.canvas().generationSize();
        int targetSize = settings.canvas().targetSize();
        double ratio = settings.alignment().rootZoneRatio();

        byte[] anchorBytes = readAnchor(manifest.anchorPath());
        DecodedImage decoded = imageCodec.decode(anchorBytes)
                .orElseThrow(() -> new ConfigException("Anchor image could not be decoded: " + manifest.anchorPath()));
        PixelBuffer anchorPixels = decoded.pixels();
        if (anchorPixels.width() != generationSize || anchorPixels.height() != generationSize) {
            throw new ConfigException("Anchor must be " + generationSize + "x" + generationSize + " but is "
                    + anchorPixels.width() + "x" + anchorPixels.height());
        }

        AnchorReference anchor = new AnchorReference(anchorPixels, anchorAnalyzer, ratio);
        anchor.target();

        PixelBuffer auditAnchor = settings.canvas().scaleFactor() == 1
                ? anchorPixels.copy()
                : downsampler.downsample(anchorPixels, targetSize);
        AnchorAnalysis auditAnalysis = anchorAnalyzer.analyze(auditAnchor, ratio);
        if (!auditAnalysis.ok()) {
            throw new ConfigException("Anchor at target resolution is unusable: " + auditAnalysis.message());
        }

        List<Integer> palette = resolvePalette(manifest, auditAnchor);

        ctx.setAnchorBytes(anchorBytes);
        ctx.setAnchor(anchor);
        ctx.setAuditAnchor(auditAnchor);
        ctx.setAuditTarget(auditAnalysis.target());
        ctx.setPalette(palette);
        ctx.setAuditContext(new AuditContext(auditAnchor, auditAnalysis.target(), palette, null,
                manifest.moveType(), targetSize, ratio, settings.targetMaxShiftX(), settings.thresholds()));
        ctx.setFingerprint(manifestFingerprint.compute(manifest, settings, anchorBytes));

        ctx.setState(loadOrStart(ctx));
        restoreLastApproved(ctx);
        persist(ctx);

        log.info("[Orchestrator] Run {} ready: {} frames, anchor baselineY={} rootX={}, palette {} colours",
                manifest.runId(), manifest.frameCount(), anchor.target().baselineY(), anchor.target().rootX(),
                palette.size());
    }

    private byte[] readAnchor(String anchorPath) {
        if (anchorPath == null || anchorPath.isBlank()) {
            throw new ConfigException("Anchor path is required");
        }
        try {
            return Files.readAllBytes(Path.of(anchorPath));
        } catch (IOException e) {
            throw new ConfigException("Anchor image could not be read: " + anchorPath, e);
        }
    }

    private List<Integer> resolvePalette(RunManifest manifest, PixelBuffer auditAnchor) {
        List<Integer> palette;
        if (manifest.palette() != null && !manifest.palette().isEmpty()) {
            palette = manifest.palette().stream().map(ColorMath::parseHex).toList();
        } else {
            palette = paletteCalculator.extractPalette(auditAnchor, PALETTE_EXTRACTION_LIMIT);
            log.info("[Orchestrator] No palette in manifest, derived {} colours from the anchor", palette.size());
        }
        if (palette.isEmpty()) {
            throw new ConfigException("Palette is empty and the anchor has no opaque colours");
        }
        return palette;
    }

    private RunState loadOrStart(RunContext ctx) {
        RunManifest manifest = ctx.getManifest();
        Optional<RunState> persisted = stateStore.load(ctx.getWorkspace());
        if (persisted.isEmpty()) {
            return RunState.start(manifest.runId(), manifest.moveId(), ctx.getFingerprint(),
                    manifest.frameCount(), now());
        }

        RunState state = persisted.get();
        if (state.totalFrames() != manifest.frameCount()) {
            throw new ConfigException("Persisted run " + manifest.runId() + " has " + state.totalFrames()
                    + " frames but the manifest asks for " + manifest.frameCount());
        }
        if (!ctx.getFingerprint().equals(state.getManifestFingerprint())) {
            if (!ctx.isOverrideFingerprint()) {
                throw new ResumeConflictException(manifest.runId(), state.getManifestFingerprint(), ctx.getFingerprint());
            }
            log.warn("[Orchestrator] Run {} resumed with a changed configuration (fingerprint {} -> {})",
                    manifest.runId(), state.getManifestFingerprint(), ctx.getFingerprint());
            state.setManifestFingerprint(ctx.getFingerprint());
        }

        state.getFrames().forEach(FrameState::recoverInFlight);
        state.setStatus(RunStatus.IN_PROGRESS);
        state.setStopReason(null);
        stopEvaluator.refresh(state);
        log.info("[Orchestrator] Resuming run {} at frame {} ({} approved, {} rejected)",
                manifest.runId(), state.firstNonTerminalIndex(),
                state.countWithStatus(FrameStatus.APPROVED), state.countWithStatus(FrameStatus.REJECTED));
        return state;
    }

    private void restoreLastApproved(RunContext ctx) {
        List<FrameState> frames = ctx.getState().getFrames();
        int resumeAt = ctx.getState().firstNonTerminalIndex();
        int limit = resumeAt < 0 ? frames.size() : resumeAt;
        for (int i = limit - 1; i >= 0; i--) {
            if (frames.get(i).getStatus() == FrameStatus.APPROVED) {
                ctx.setLastApproved(approvedImage(ctx, i));
                return;
            }
        }
    }

    // ===== Frame loop =====

    /**
     * Runs attempts until the frame is finalized.
     *
     * @return a stop reason when the run must halt before the frame is finalized
     */
    Optional<StopReason> processFrame(RunContext ctx, FrameState frame) {
        ctx.setLastCandidate(null);
        while (true) {
            RetryAction next = frame.getAttempts().isEmpty() ? RetryAction.INITIAL : frame.lastAttempt().decision();
            if (next == RetryAction.ACCEPT) {
                approve(ctx, frame);
                return Optional.empty();
            }
            if (next == RetryAction.REJECT) {
                reject(ctx, frame);
                return Optional.empty();
            }

            if (ctx.getToken().isCancelled()) {
                return Optional.of(userInterrupt());
            }
            stopEvaluator.refresh(ctx.getState());
            Optional<StopReason> breaker = stopEvaluator.checkCircuitBreaker(
                    ctx.getState(), ctx.getSettings().stopConditions());
            if (breaker.isPresent()) {
                return breaker;
            }

            boolean completed = next.regenerates()
                    ? generateAttempt(ctx, frame, next)
                    : postProcessAttempt(ctx, frame, next);
            if (!completed) {
                return Optional.of(userInterrupt());
            }
        }
    }

    /**
     * @return false when cancelled while backing off
     */
    private boolean generateAttempt(RunContext ctx, FrameState frame, RetryAction strategy) {
        RunManifest manifest = ctx.getManifest();
        PipelineSettings settings = ctx.getSettings();
        int frameIndex = frame.getIndex();
        int attemptIndex = frame.attemptCount() + 1;
        int totalFrames = ctx.getState().totalFrames();

        transition(ctx, frame, FrameStatus.GENERATING);

        FrameState previous = frameIndex > 0 ? ctx.getState().frame(frameIndex - 1) : null;
        PixelBuffer previousImage = previous != null && previous.getStatus() == FrameStatus.APPROVED
                ? downsampler.upscale(approvedImage(ctx, frameIndex - 1), settings.canvas().scaleFactor())
                : null;
        List<ReferenceImage> references = chainResolver.resolve(frameIndex, ctx.getAnchor().image(), previous,
                previousImage, strategy, settings.thresholds().identityMin());
        boolean loopClosure = chainResolver.isLoopClosure(manifest.cyclic(), frameIndex, totalFrames);
        BuiltPrompt prompt = promptBuilder.build(settings.prompts(), manifest.characterId(), manifest.moveId(),
                frameIndex, totalFrames, attemptIndex, strategy, loopClosure);
        long seed = seedPolicy.seedFor(manifest.runId(), frameIndex, attemptIndex);

        GenerationRequest request = new GenerationRequest(manifest.runId(), frameIndex, attemptIndex, totalFrames,
                references, prompt.prompt(), prompt.negativePrompt(), settings.canvas().generationSize(), seed,
                loopClosure, strategy);
        log.info("[Orchestrator] Frame {} attempt {} ({}) via {}, refs={}, seed={}",
                frameIndex, attemptIndex, strategy, generator.name(), references.size(), seed);

        CandidateResult result;
        try {
            Optional<CandidateResult> generated = callWithBackoff(ctx, request);
            if (generated.isEmpty()) {
                return false;
            }
            result = generated.get();
        } catch (GenerationException e) {
            ReasonCode code = e.getFailure() == GenerationFailure.FAIL_FAST
                    ? ReasonCode.SYS_GENERATION_FAILED
                    : ReasonCode.SYS_GENERATOR_TRANSIENT;
            log.warn("[Orchestrator] Frame {} attempt {} generation failed ({}): {}",
                    frameIndex, attemptIndex, code, e.getMessage());
            AuditResult failed = AuditResult.hardFail(code);
            recordAndDecide(ctx, frame, new AttemptRecord(attemptIndex, now(), strategy, seed, prompt.hash(),
                    null, null, failed.reasonCodes(), null, null));
            return true;
        }

        Long usedSeed = result.seed() != null ? result.seed() : seed;
        FrameCandidate candidate = new FrameCandidate(frameIndex, attemptIndex, result.imageData(), usedSeed, prompt.hash());

        transition(ctx, frame, FrameStatus.NORMALIZING);
        NormalizedFrame normalized = normalizer.normalize(candidate, ctx.alignmentTarget(), settings.alignment(),
                settings.canvas(), settings.transparency());
        String candidatePath = storeCandidate(ctx, normalized);

        transition(ctx, frame, FrameStatus.AUDITING);
        AuditResult audit = auditor.audit(normalized, ctx.getAuditContext().withPreviousApproved(ctx.getLastApproved()));
        ctx.setLastCandidate(normalized.pixels() != null ? normalized : ctx.getLastCandidate());
        writeFrameMetrics(ctx, FrameMetricsReport.of(frameIndex, attemptIndex, strategy, audit, now()));

        recordAndDecide(ctx, frame, new AttemptRecord(attemptIndex, now(), strategy, usedSeed, prompt.hash(),
                compositeOf(audit), audit.score(Metric.IDENTITY), audit.reasonCodes(), null, candidatePath));
        return true;
    }

    private boolean postProcessAttempt(RunContext ctx, FrameState frame, RetryAction strategy) {
        int attemptIndex = frame.attemptCount() + 1;
        NormalizedFrame source = lastCandidate(ctx, frame);

        transition(ctx, frame, FrameStatus.AUDITING);
        PixelBuffer cleaned = postProcessor.cleanup(source.pixels(), ctx.getPalette(),
                ctx.getSettings().thresholds().paletteTolerance());
        NormalizedFrame processed = normalizer.rewrap(source, cleaned, attemptIndex);
        String candidatePath = storeCandidate(ctx, processed);

        AuditResult audit = auditor.audit(processed, ctx.getAuditContext().withPreviousApproved(ctx.getLastApproved()));
        ctx.setLastCandidate(processed);
        writeFrameMetrics(ctx, FrameMetricsReport.of(frame.getIndex(), attemptIndex, strategy, audit, now()));

        recordAndDecide(ctx, frame, new AttemptRecord(attemptIndex, now(), strategy, null, null,
                compositeOf(audit), audit.score(Metric.IDENTITY), audit.reasonCodes(), null, candidatePath));
        return true;
    }

    private void recordAndDecide(RunContext ctx, FrameState frame, AttemptRecord attempt) {
        frame.getAttempts().add(attempt);
        RetryDecision decision = retryLadder.decide(attempt.reasonCodes(), frame.getAttempts(),
                ctx.getSettings().retry());
        frame.replaceLastAttempt(attempt.withDecision(decision.action()));
        if (decision.terminal() && !decision.isApproval()) {
            frame.setFinalReason(decision.primaryReason());
            frame.setRejectionNote(decision.rationale());
        }
        log.info("[Orchestrator] Frame {} attempt {}: reasons={} -> {} ({})", frame.getIndex(),
                attempt.attemptIndex(), attempt.reasonCodes(), decision.action(), decision.rationale());
        transition(ctx, frame, FrameStatus.RETRY_DECIDING);
    }

    Optional<CandidateResult> callWithBackoff(RunContext ctx, GenerationRequest request) {
        PipelineSettings settings = ctx.getSettings();
        int waits = 0;
        while (true) {
            try {
                return Optional.of(generator.generate(request));
            } catch (GenerationException e) {
                if (e.getFailure() != GenerationFailure.RATE_LIMITED) {
                    throw e;
                }
                if (waits >= settings.maxRateLimitWaits()) {
                    throw new GenerationException(GenerationFailure.TRANSIENT,
                            "Still rate limited after " + waits + " back-off rounds", e);
                }
                Duration wait = e.getRetryAfter() != null ? e.getRetryAfter() : settings.defaultBackoff();
                waits++;
                log.warn("[Orchestrator] Frame {} rate limited, backing off {}ms ({}/{})",
                        request.frameIndex(), wait.toMillis(), waits, settings.maxRateLimitWaits());
                if (!ctx.getToken().sleep(wait)) {
                    return Optional.empty();
                }
            }
        }
    }

    // ===== Finalization =====

    private void approve(RunContext ctx, FrameState frame) {
        NormalizedFrame candidate = lastCandidate(ctx, frame);
        Path approvedPath = ctx.getWorkspace().approvedPath(ctx.getManifest().moveId(), frame.getIndex());
        stateStore.writeAtomically(approvedPath, candidate.encoded());

        AttemptRecord last = frame.lastAttempt();
        frame.setApprovedPath(approvedPath.toString());
        frame.setIdentityScore(last.identityScore());
        frame.setFinalReason(null);
        frame.setRejectionNote(null);
        ctx.getApprovedImages().put(frame.getIndex(), candidate.pixels());
        ctx.setLastApproved(candidate.pixels());
        transition(ctx, frame, FrameStatus.APPROVED);
        log.info("[Orchestrator] Frame {} approved after {} attempt(s), composite={}",
                frame.getIndex(), frame.attemptCount(), last.compositeScore());
    }

    private void reject(RunContext ctx, FrameState frame) {
        transition(ctx, frame, FrameStatus.REJECTED);
        log.warn("[Orchestrator] Frame {} rejected after {} attempt(s): {} ({})",
                frame.getIndex(), frame.attemptCount(), frame.getFinalReason(), frame.getRejectionNote());
    }

    private RunState stopRun(RunContext ctx, StopReason reason) {
        RunState state = ctx.getState();
        state.getFrames().forEach(FrameState::recoverInFlight);
        stopEvaluator.refresh(state);
        state.setStatus(RunStatus.STOPPED);
        state.setStopReason(reason);
        persist(ctx);
        writeDiagnostic(ctx, reason);
        writeSummary(ctx, false);
        log.warn("[Orchestrator] Run {} stopped: {}", state.getRunId(), reason.message());
        return state;
    }

    private RunState interrupt(RunContext ctx) {
        return stopRun(ctx, userInterrupt());
    }

    private RunState finish(RunContext ctx) {
        RunState state = ctx.getState();
        stopEvaluator.refresh(state);
        state.setStatus(RunStatus.COMPLETED);
        persist(ctx);
        log.info("[Orchestrator] Run {} completed: {} approved, {} rejected, {} attempts",
                state.getRunId(), state.countWithStatus(FrameStatus.APPROVED),
                state.countWithStatus(FrameStatus.REJECTED), state.getTotalAttempts());

        boolean exported = false;
        if (state.allApproved()) {
            exported = exportService.export(state, ctx.getWorkspace(), false);
            persist(ctx);
        }
        writeSummary(ctx, exported);
        return state;
    }

    private void markFailed(RunContext ctx, RuntimeException cause) {
        RunState state = ctx.getState();
        log.error("[Orchestrator] Run {} failed", state.getRunId(), cause);
        StopReason reason = new StopReason(StopCondition.SYSTEM_ERROR, 0, 0,
                cause.getClass().getSimpleName() + ": " + cause.getMessage());
        try {
            state.getFrames().forEach(FrameState::recoverInFlight);
            state.setStatus(RunStatus.FAILED);
            state.setStopReason(reason);
            persist(ctx);
            writeDiagnostic(ctx, reason);
            writeSummary(ctx, false);
        } catch (StateStoreException e) {
            cause.addSuppressed(e);
        }
    }

    // ===== Helpers =====

    private void transition(RunContext ctx, FrameState frame, FrameStatus next) {
        frame.transitionTo(next);
        persist(ctx);
    }

    private void persist(RunContext ctx) {
        ctx.getState().setUpdatedAt(now());
        stateStore.save(ctx.getWorkspace(), ctx.getState());
    }

    private void writeDiagnostic(RunContext ctx, StopReason reason) {
        DiagnosticReport report = diagnosticGenerator.generate(ctx.getState(), reason, now());
        stateStore.writeJson(ctx.getWorkspace().diagnosticPath(), report);
    }

    private void writeFrameMetrics(RunContext ctx, FrameMetricsReport metrics) {
        stateStore.writeJson(ctx.getWorkspace().frameMetricsPath(metrics.frameIndex()), metrics);
    }

    /**
     * The run outcome is already persisted when this runs, so a failed write is logged and not rethrown.
     */
    private void writeSummary(RunContext ctx, boolean exported) {
        RunWorkspace workspace = ctx.getWorkspace();
        RunSummaryReport summary = summaryGenerator.generate(ctx.getState(),
                exported ? workspace.atlasImagePath() : null, now());
        try {
            stateStore.writeJson(workspace.summaryPath(), summary);
        } catch (StateStoreException e) {
            log.error("[Orchestrator] Summary for run {} could not be written", ctx.getState().getRunId(), e);
        }
    }

    private String storeCandidate(RunContext ctx, NormalizedFrame normalized) {
        if (normalized.pixels() == null) {
            return null;
        }
        Path path = ctx.getWorkspace().candidatePath(normalized.frameIndex(), normalized.attemptIndex());
        stateStore.writeAtomically(path, normalized.encoded());
        return path.toString();
    }

    /**
     * The most recent audited candidate of the frame, from memory or re-read from disk after a resume.
     */
    private NormalizedFrame lastCandidate(RunContext ctx, FrameState frame) {
        NormalizedFrame cached = ctx.getLastCandidate();
        if (cached != null && cached.frameIndex() == frame.getIndex()) {
            return cached;
        }
        List<AttemptRecord> attempts = frame.getAttempts();
        for (int i = attempts.size() - 1; i >= 0; i--) {
            AttemptRecord attempt = attempts.get(i);
            if (attempt.candidatePath() != null) {
                byte[] bytes = stateStore.readBytes(Path.of(attempt.candidatePath()));
                PixelBuffer pixels = imageCodec.decode(bytes)
                        .orElseThrow(() -> new StateStoreException("Stored candidate is unreadable: "
                                + attempt.candidatePath()))
                        .pixels();
                NormalizedFrame restored = new NormalizedFrame(frame.getIndex(), attempt.attemptIndex(), pixels,
                        bytes, AlignmentResult.unchanged(pixels), null, List.of());
                ctx.setLastCandidate(restored);
                return restored;
            }
        }
        throw new IllegalStateException("Frame " + frame.getIndex() + " has no stored candidate");
    }

    private PixelBuffer approvedImage(RunContext ctx, int frameIndex) {
        PixelBuffer cached = ctx.getApprovedImages().get(frameIndex);
        if (cached != null) {
            return cached;
        }
        Path path = ctx.getWorkspace().approvedPath(ctx.getManifest().moveId(), frameIndex);
        PixelBuffer pixels = imageCodec.decode(stateStore.readBytes(path))
                .orElseThrow(() -> new StateStoreException("Approved frame is unreadable: " + path))
                .pixels();
        ctx.getApprovedImages().put(frameIndex, pixels);
        return pixels;
    }

    private static Double compositeOf(AuditResult audit) {
        return audit.softMetricsComputed() > 0 ? audit.compositeScore() : null;
    }

    private static StopReason userInterrupt() {
        return new StopReason(StopCondition.USER_INTERRUPT, 0, 0, "Run cancelled by user");
    }

    private Instant now() {
        return Instant.now(clock);
    }
}
