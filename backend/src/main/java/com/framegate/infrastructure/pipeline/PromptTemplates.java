package com.framegate.infrastructure.pipeline;

/**
 * Prompt templates with {@code {frame_index}}, {@code {total_frames}}, {@code {attempt_index}},
 * {@code {character_id}} and {@code {move_id}} placeholders.
 *
 * @param master      first attempt of frame 0
 * @param variation   every other regular attempt
 * @param lock        identity rescue and re-anchor attempts
 * @param negative    base negative prompt
 * @param loopClosure appended on the last frame of a cyclic move
 */
public record PromptTemplates(
        String master,
        String variation,
        String lock,
        String negative,
        String loopClosure
) {

    public static PromptTemplates defaults() {
        return new PromptTemplates(
                "Pixel-art sprite of {character_id} performing {move_id}, frame {frame_index} of {total_frames}. "
                        + "Match [IMAGE 1] exactly: same proportions, outfit and palette. Transparent background, "
                        + "crisp 1px outlines, no anti-aliasing.",
                "Next pose of {character_id} performing {move_id}, frame {frame_index} of {total_frames} "
                        + "(attempt {attempt_index}). Keep identity, palette and ground line identical to [IMAGE 1]; "
                        + "continue the motion from [IMAGE 2] when it is provided.",
                "Redraw {character_id} strictly from [IMAGE 1] for {move_id} frame {frame_index} of {total_frames}. "
                        + "Identity, proportions and palette must match the anchor exactly.",
                "AVOID: blur, gradients, anti-aliased edges, semi-transparent pixels, background scenery, text",
                "LOOP CLOSURE: this is the final frame of a cyclic move. Move about 85% of the way back toward "
                        + "the pose in [IMAGE 1] so the loop reads seamlessly.");
    }
}
