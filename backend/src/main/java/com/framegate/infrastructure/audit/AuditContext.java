package com.framegate.infrastructure.audit;

import com.framegate.domain.frame.model.AlignmentTarget;
import com.framegate.domain.frame.model.PixelBuffer;

import java.util.List;

/**
 * Run-level references a frame is audited against.
 *
 * @param anchor           anchor image at target resolution
 * @param anchorTarget     alignment target measured on {@code anchor}
 * @param palette          allowed colours as {@code 0xRRGGBB}
 * @param previousApproved last approved frame (nullable)
 * @param maxShiftX        safety valve bound at target resolution
 */
public record AuditContext(
        PixelBuffer anchor,
        AlignmentTarget anchorTarget,
        List<Integer> palette,
        PixelBuffer previousApproved,
        String moveType,
        int targetSize,
        double rootZoneRatio,
        int maxShiftX,
        AuditThresholds thresholds
) {

    public AuditContext withPreviousApproved(PixelBuffer previous) {
        return new AuditContext(anchor, anchorTarget, palette, previous, moveType,
                targetSize, rootZoneRatio, maxShiftX, thresholds);
    }
}
