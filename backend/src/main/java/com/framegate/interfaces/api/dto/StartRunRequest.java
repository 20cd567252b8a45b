package com.framegate.interfaces.api.dto;

import com.framegate.domain.frame.model.ManifestThresholds;
import com.framegate.domain.frame.model.RunManifest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.util.List;

public record StartRunRequest(
        @NotBlank(message = "Run id is required")
        @Pattern(regexp = "^[A-Za-z0-9_-]+$", message = "Run id may only contain letters, digits, '-' and '_'")
        String runId,

        @NotBlank(message = "Character id is required")
        String characterId,

        @NotBlank(message = "Move id is required")
        @Pattern(regexp = "^[a-z_]+$", message = "Move id must be lowercase letters and underscores")
        String moveId,

        @NotBlank(message = "Move type is required")
        String moveType,

        @Min(value = 1, message = "Frame count must be at least 1")
        @Max(value = 10000, message = "Frame count must not exceed 10000")
        int frameCount,

        boolean cyclic,

        @NotBlank(message = "Anchor path is required")
        String anchorPath,

        List<String> palette,

        ManifestThresholds thresholds,

        boolean overrideFingerprint
) {

    public RunManifest toManifest() {
        return new RunManifest(runId, characterId, moveId, moveType, frameCount, cyclic, anchorPath,
                palette == null ? List.of() : List.copyOf(palette), thresholds);
    }
}
