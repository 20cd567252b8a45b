package com.framegate.infrastructure.audit;

import com.framegate.domain.frame.model.NormalizedFrame;
import com.framegate.domain.frame.model.PixelBuffer;
import com.framegate.domain.frame.model.ReasonCode;
import com.framegate.infrastructure.imaging.DecodedImage;
import com.framegate.infrastructure.imaging.ImageCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Structural gates, evaluated in a fixed order. The first failure wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HardGateEvaluator {

    private final ImageCodec imageCodec;

    public Optional<ReasonCode> evaluate(NormalizedFrame frame, int targetSize, AuditThresholds thresholds) {
        if (frame.upstreamFailure() != null) {
            return fail(frame, frame.upstreamFailure(), "raised during normalization");
        }

        PixelBuffer pixels = frame.pixels();

        // HF01
        if (pixels == null || pixels.width() != targetSize || pixels.height() != targetSize) {
            return fail(frame, ReasonCode.HF01_DIMENSION_MISMATCH,
                    pixels == null ? "no pixels" : pixels.width() + "x" + pixels.height() + " != " + targetSize);
        }

        // HF02
        if (pixels.isFullyTransparent()) {
            return fail(frame, ReasonCode.HF02_FULLY_TRANSPARENT, "no pixel with alpha > 0");
        }

        // HF03
        Optional<DecodedImage> decoded = imageCodec.decode(frame.encoded());
        if (decoded.isEmpty()
                || decoded.get().pixels().width() != pixels.width()
                || decoded.get().pixels().height() != pixels.height()) {
            return fail(frame, ReasonCode.HF03_IMAGE_CORRUPTED, "encoded bytes do not decode to the frame");
        }

        // HF04
        if (!decoded.get().hasAlpha() || decoded.get().channels() != 4) {
            return fail(frame, ReasonCode.HF04_WRONG_COLOR_DEPTH, decoded.get().channels() + " channels");
        }

        // HF05
        int size = frame.encoded().length;
        if (size < thresholds.minFileBytes() || size > thresholds.maxFileBytes()) {
            return fail(frame, ReasonCode.HF05_FILE_SIZE_INVALID,
                    size + " bytes outside [" + thresholds.minFileBytes() + ", " + thresholds.maxFileBytes() + "]");
        }

        return Optional.empty();
    }

    private Optional<ReasonCode> fail(NormalizedFrame frame, ReasonCode code, String detail) {
        log.info("[HardGate] Frame {} attempt {} failed {}: {}",
                frame.frameIndex(), frame.attemptIndex(), code, detail);
        return Optional.of(code);
    }
}
