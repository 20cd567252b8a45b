package com.framegate.domain.frame.model;

/**
 * Recovery strategies of the retry ladder, plus the bookkeeping values used for the first
 * attempt and for terminal verdicts.
 */
public enum RetryAction {

    INITIAL(0, true, false, null),
    DEFAULT_REGENERATE(0, true, false, null),
    REROLL_SEED(1, true, false, null),
    TIGHTEN_NEGATIVE(2, true, false,
            "AVOID: colors outside the established palette, soft or blurred edges, anti-aliasing, "
                    + "gradients, extra limbs, background elements"),
    IDENTITY_RESCUE(3, true, true,
            "IDENTITY RESCUE: match the master anchor exactly in proportions, outfit and colors. "
                    + "Ignore any previous frame."),
    POSE_RESCUE(4, true, false,
            "POSE RESCUE: keep the feet planted on the same ground line as the anchor and keep the "
                    + "body centered over its contact point."),
    POST_PROCESS(5, false, false, null),
    RE_ANCHOR(6, true, true,
            "RE-ANCHOR: redraw from the master anchor only, preserving silhouette and palette exactly."),
    ACCEPT(-1, false, false, null),
    REJECT(-1, false, false, null);

    private final int level;
    private final boolean regenerates;
    private final boolean reAnchor;
    private final String promptDirective;

    RetryAction(int level, boolean regenerates, boolean reAnchor, String promptDirective) {
        this.level = level;
        this.regenerates = regenerates;
        this.reAnchor = reAnchor;
        this.promptDirective = promptDirective;
    }

    public int getLevel() {
        return level;
    }

    /** False for cleanup-only steps that re-audit the last candidate. */
    public boolean regenerates() {
        return regenerates;
    }

    /** Re-anchoring drops the previous-frame reference and counts toward identity collapse. */
    public boolean isReAnchor() {
        return reAnchor;
    }

    public String getPromptDirective() {
        return promptDirective;
    }
}
