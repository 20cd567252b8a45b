package com.framegate.domain.frame.model;

/**
 * Outcome of aligning one frame.
 *
 * @param buffer          shifted buffer, same dimensions as the input
 * @param shiftX          applied horizontal shift, always within the safety-valve bound
 * @param shiftY          applied vertical shift
 * @param clamped         whether the horizontal shift hit the safety valve
 * @param requestedShiftX horizontal shift before clamping
 */
public record AlignmentResult(
        PixelBuffer buffer,
        int shiftX,
        int shiftY,
        boolean clamped,
        int requestedShiftX
) {

    public static AlignmentResult unchanged(PixelBuffer buffer) {
        return new AlignmentResult(buffer, 0, 0, false, 0);
    }
}
