package com.framegate.infrastructure.imaging;

import com.framegate.domain.frame.model.AlignmentConfig;
import com.framegate.domain.frame.model.AlignmentResult;
import com.framegate.domain.frame.model.AlignmentTarget;
import com.framegate.domain.frame.model.CanvasConfig;
import com.framegate.domain.frame.model.FrameCandidate;
import com.framegate.domain.frame.model.NormalizedFrame;
import com.framegate.domain.frame.model.PixelBuffer;
import com.framegate.domain.frame.model.ReasonCode;
import com.framegate.domain.frame.model.TransparencyConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a raw generator candidate into a canvas-exact frame:
 * <p>
 * decode → transparency → contact patch alignment (generation resolution) → downsample → size check
 * </p>
 * Failures are not corrected here. They travel on the {@link NormalizedFrame} and the auditor
 * reports them as hard gates.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FrameNormalizer {

    private final ImageCodec imageCodec;
    private final TransparencyEnforcer transparencyEnforcer;
    private final ContactPatchAligner aligner;
    private final Downsampler downsampler;

    public NormalizedFrame normalize(FrameCandidate candidate,
                                     AlignmentTarget target,
                                     AlignmentConfig alignment,
                                     CanvasConfig canvas,
                                     TransparencyConfig transparency) {
        long start = System.nanoTime();
        int frameIndex = candidate.frameIndex();
        int attemptIndex = candidate.attemptIndex();

        // 0. Decode
        Optional<DecodedImage> decoded = imageCodec.decode(candidate.imageData());
        if (decoded.isEmpty()) {
            log.warn("[Normalizer] Frame {} attempt {}: candidate could not be decoded", frameIndex, attemptIndex);
            return NormalizedFrame.failed(frameIndex, attemptIndex, ReasonCode.HF03_IMAGE_CORRUPTED);
        }

        // 1. Transparency
        TransparencyOutcome keyed = transparencyEnforcer.enforce(decoded.get(), transparency);
        if (keyed.failure() != null) {
            return NormalizedFrame.failed(frameIndex, attemptIndex, keyed.failure());
        }
        List<ReasonCode> warnings = new ArrayList<>();
        if (keyed.fringeRisk()) {
            warnings.add(ReasonCode.SF_FRINGE_RISK);
        }

        // 2. Align at generation resolution
        AlignmentResult aligned = aligner.align(keyed.buffer(), target, alignment);

        // 3. Downsample by the configured factor. A wrongly sized candidate stays wrongly sized.
        PixelBuffer buffer = aligned.buffer();
        int factor = canvas.scaleFactor();
        PixelBuffer output = factor == 1
                ? buffer
                : downsampler.resize(buffer, Math.max(1, buffer.width() / factor), Math.max(1, buffer.height() / factor));

        // 4. Size check
        ReasonCode sizeFailure = null;
        if (output.width() != canvas.targetSize() || output.height() != canvas.targetSize()) {
            log.warn("[Normalizer] Frame {} attempt {}: output {}x{} does not match target {}",
                    frameIndex, attemptIndex, output.width(), output.height(), canvas.targetSize());
            sizeFailure = ReasonCode.HF01_DIMENSION_MISMATCH;
        }

        byte[] encoded = imageCodec.encodePng(output);
        log.debug("[Normalizer] Frame {} attempt {} normalized in {}ms (shiftX={}, shiftY={})",
                frameIndex, attemptIndex, (System.nanoTime() - start) / 1_000_000,
                aligned.shiftX(), aligned.shiftY());

        return new NormalizedFrame(frameIndex, attemptIndex, output, encoded, aligned, sizeFailure, List.copyOf(warnings));
    }

    /**
     * Re-wraps an already target-sized buffer, e.g. after cleanup, keeping the original
     * alignment metadata.
     */
    public NormalizedFrame rewrap(NormalizedFrame source, PixelBuffer pixels, int attemptIndex) {
        return new NormalizedFrame(source.frameIndex(), attemptIndex, pixels, imageCodec.encodePng(pixels),
                source.alignment(), null, source.warnings());
    }
}
