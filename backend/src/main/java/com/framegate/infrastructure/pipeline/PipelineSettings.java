package com.framegate.infrastructure.pipeline;

import com.framegate.domain.frame.model.AlignmentConfig;
import com.framegate.domain.frame.model.CanvasConfig;
import com.framegate.domain.frame.model.TransparencyConfig;
import com.framegate.infrastructure.audit.AuditThresholds;
import com.framegate.infrastructure.retry.RetryPolicy;

import java.time.Duration;

/**
 * Fully resolved, validated settings for one run. Part of the manifest fingerprint.
 *
 * @param maxRateLimitWaits back-off rounds per attempt before a rate limit counts as transient
 * @param defaultBackoff    wait used when the generator gives no retry-after hint
 */
public record PipelineSettings(
        AlignmentConfig alignment,
        CanvasConfig canvas,
        TransparencyConfig transparency,
        AuditThresholds thresholds,
        RetryPolicy retry,
        StopConditions stopConditions,
        PromptTemplates prompts,
        int maxRateLimitWaits,
        Duration defaultBackoff
) {

    /** Safety valve bound expressed at target resolution. */
    public int targetMaxShiftX() {
        return Math.max(1, alignment.maxShiftX() / canvas.scaleFactor());
    }
}
