package com.framegate.infrastructure.pipeline;

import com.framegate.domain.frame.model.FrameState;
import com.framegate.domain.frame.model.FrameStatus;
import com.framegate.domain.frame.model.PixelBuffer;
import com.framegate.domain.frame.model.ReferenceImage;
import com.framegate.domain.frame.model.ReferenceRole;
import com.framegate.domain.frame.model.RetryAction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Chooses the reference images sent with a generation request. Evaluated fresh for every
 * attempt; nothing is cached between attempts.
 */
@Slf4j
@Component
public class ReferenceChainResolver {

    /**
     * @param previousFrame state of frame {@code frameIndex - 1} (null for frame 0)
     * @param previousImage approved image of that frame (null when not approved)
     */
    public List<ReferenceImage> resolve(int frameIndex,
                                        PixelBuffer anchor,
                                        FrameState previousFrame,
                                        PixelBuffer previousImage,
                                        RetryAction strategy,
                                        double identityMin) {
        List<ReferenceImage> references = new ArrayList<>();
        references.add(new ReferenceImage(ReferenceRole.ANCHOR, anchor));

        if (frameIndex == 0 || previousFrame == null) {
            return references;
        }
        if (strategy.isReAnchor()) {
            log.info("[Chain] Frame {}: {} uses the anchor only", frameIndex, strategy);
            return references;
        }
        if (previousFrame.getStatus() != FrameStatus.APPROVED || previousImage == null) {
            log.info("[Chain] Frame {}: previous frame not approved, anchor only", frameIndex);
            return references;
        }
        Double identity = previousFrame.getIdentityScore();
        if (identity == null || identity < identityMin) {
            log.info("[Chain] Frame {}: previous identity {} below {}, anchor only", frameIndex, identity, identityMin);
            return references;
        }

        references.add(new ReferenceImage(ReferenceRole.PREVIOUS_FRAME, previousImage));
        return references;
    }

    public boolean isLoopClosure(boolean cyclic, int frameIndex, int totalFrames) {
        return cyclic && totalFrames > 1 && frameIndex == totalFrames - 1;
    }
}
