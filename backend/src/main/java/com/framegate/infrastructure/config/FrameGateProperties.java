package com.framegate.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw {@code framegate.*} settings from application.yml. Resolved and validated by
 * {@link PipelineSettingsFactory}.
 */
@Data
@ConfigurationProperties(prefix = "framegate")
public class FrameGateProperties {

    private Alignment alignment = new Alignment();
    private Canvas canvas = new Canvas();
    private Transparency transparency = new Transparency();
    private Auditor auditor = new Auditor();
    private Retry retry = new Retry();
    private Storage storage = new Storage();
    private Prompts prompts = new Prompts();

    @Data
    public static class Alignment {
        private String method = "contact-patch";
        private boolean verticalLock = true;
        private double rootZoneRatio = 0.15;
        private int maxShiftX = 32;
    }

    @Data
    public static class Canvas {
        private int generationSize = 512;
        private int targetSize = 128;
    }

    @Data
    public static class Transparency {
        private String strategy = "true-alpha";
        private String chromaColor = "#00FF00";
        private double chromaTolerance = 30;
    }

    @Data
    public static class Auditor {
        private Thresholds thresholds = new Thresholds();
        private Weights weights = new Weights();
        private Map<String, Double> mapd = new LinkedHashMap<>(Map.of(
                "idle", 0.02, "block", 0.05, "walk", 0.10, "run", 0.15, "default", 0.10));
        private List<String> mapdBypass = new ArrayList<>(List.of("attack", "jump", "hit"));
    }

    @Data
    public static class Thresholds {
        private double identityMin = 0.85;
        private double paletteMin = 0.90;
        private double paletteTolerance = 30;
        private double alphaArtifactMax = 0.20;
        private int baselineDriftMax = 1;
        private int orphanWarn = 5;
        private int orphanMax = 15;
        private double compositeMin = 0.70;
        private int minFileBytes = 67;
        private int maxFileBytes = 5 * 1024 * 1024;
    }

    @Data
    public static class Weights {
        private double stability = 0.35;
        private double identity = 0.30;
        private double palette = 0.20;
        private double style = 0.15;
    }

    @Data
    public static class Retry {
        private List<String> ladderOrder = new ArrayList<>(List.of(
                "reroll-seed", "tighten-negative", "identity-rescue", "pose-rescue", "post-process", "re-anchor"));
        private int maxAttemptsPerFrame = 5;
        private int maxRateLimitWaits = 3;
        private Duration defaultBackoff = Duration.ofSeconds(30);
        private StopConditions stopConditions = new StopConditions();
    }

    @Data
    public static class StopConditions {
        private double maxRetryRate = 0.50;
        private double maxRejectRate = 0.30;
        private int maxConsecutiveFails = 5;
        private int circuitBreakerLimit = 50;
    }

    @Data
    public static class Storage {
        private String runsDir = "runs";
    }

    /** Blank entries fall back to the built-in templates. */
    @Data
    public static class Prompts {
        private String master;
        private String variation;
        private String lock;
        private String negative;
        private String loopClosure;
    }
}
