package com.framegate.infrastructure.config;

import com.framegate.domain.frame.exception.ConfigException;
import com.framegate.domain.frame.model.AlignmentMethod;
import com.framegate.domain.frame.model.ManifestThresholds;
import com.framegate.domain.frame.model.RetryAction;
import com.framegate.domain.frame.model.RunManifest;
import com.framegate.domain.frame.model.TransparencyStrategy;
import com.framegate.infrastructure.pipeline.PipelineSettings;
import com.framegate.infrastructure.pipeline.PromptTemplates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineSettingsFactoryTest {

    private FrameGateProperties properties;
    private PipelineSettingsFactory factory;

    @BeforeEach
    void setUp() {
        properties = new FrameGateProperties();
        factory = new PipelineSettingsFactory(properties);
    }

    @Test
    @DisplayName("Defaults resolve to the documented settings")
    void defaults() {
        PipelineSettings settings = factory.resolve(manifest("idle", 8, null));

        assertThat(settings.alignment().method()).isEqualTo(AlignmentMethod.CONTACT_PATCH);
        assertThat(settings.canvas().scaleFactor()).isEqualTo(4);
        assertThat(settings.targetMaxShiftX()).isEqualTo(8);
        assertThat(settings.transparency().strategy()).isEqualTo(TransparencyStrategy.TRUE_ALPHA);
        assertThat(settings.thresholds().identityMin()).isEqualTo(0.85);
        assertThat(settings.thresholds().mapdDefault()).isEqualTo(0.10);
        assertThat(settings.thresholds().mapdThresholds()).containsEntry("idle", 0.02).doesNotContainKey("default");
        assertThat(settings.thresholds().mapdBypass()).containsExactly("attack", "hit", "jump");
        assertThat(settings.retry().ladderOrder()).startsWith(RetryAction.REROLL_SEED, RetryAction.TIGHTEN_NEGATIVE);
        assertThat(settings.stopConditions().circuitBreakerLimit()).isEqualTo(50);
        assertThat(settings.prompts()).isEqualTo(PromptTemplates.defaults());
    }

    @Test
    @DisplayName("Manifest thresholds override the configured ones")
    void manifestOverrides() {
        PipelineSettings settings = factory.resolve(manifest("idle", 8,
                new ManifestThresholds(0.7, null, null, 2.0, null)));

        assertThat(settings.thresholds().identityMin()).isEqualTo(0.7);
        assertThat(settings.thresholds().baselineDriftMax()).isEqualTo(2);
        assertThat(settings.thresholds().paletteMin()).isEqualTo(0.90);
    }

    @Test
    @DisplayName("Blank prompt overrides fall back to the built-in templates")
    void promptOverrides() {
        properties.getPrompts().setMaster("custom {character_id}");
        properties.getPrompts().setLock("  ");

        PipelineSettings settings = factory.resolve(manifest("idle", 8, null));

        assertThat(settings.prompts().master()).isEqualTo("custom {character_id}");
        assertThat(settings.prompts().lock()).isEqualTo(PromptTemplates.defaults().lock());
    }

    @Nested
    @DisplayName("Invalid configuration")
    class Invalid {

        @ParameterizedTest
        @ValueSource(strings = {"Idle", "walk-cycle", "run2", ""})
        @DisplayName("Move ids must be lowercase snake case")
        void badMoveId(String moveId) {
            assertThatThrownBy(() -> factory.resolve(manifest(moveId, 8, null)))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("moveId");
        }

        @Test
        @DisplayName("Frame counts outside 1..10000 are refused")
        void badFrameCount() {
            assertThatThrownBy(() -> factory.resolve(manifest("idle", 0, null))).isInstanceOf(ConfigException.class);
            assertThatThrownBy(() -> factory.resolve(manifest("idle", 10_001, null))).isInstanceOf(ConfigException.class);
        }

        @Test
        @DisplayName("Generation size must be a multiple of the target size")
        void canvasMultiple() {
            properties.getCanvas().setGenerationSize(500);

            assertThatThrownBy(() -> factory.resolve(manifest("idle", 8, null)))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("integer multiple");
        }

        @Test
        @DisplayName("Root zone ratio is bounded")
        void rootZoneRatio() {
            properties.getAlignment().setRootZoneRatio(0.6);

            assertThatThrownBy(() -> factory.resolve(manifest("idle", 8, null)))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("root-zone-ratio");
        }

        @Test
        @DisplayName("Composite weights must sum to one")
        void weightsSum() {
            properties.getAuditor().getWeights().setStyle(0.5);

            assertThatThrownBy(() -> factory.resolve(manifest("idle", 8, null)))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("sum to 1.0");
        }

        @Test
        @DisplayName("Unknown ladder steps and duplicates are refused")
        void ladderOrder() {
            properties.getRetry().setLadderOrder(List.of("reroll-seed", "summon-help"));
            assertThatThrownBy(() -> factory.resolve(manifest("idle", 8, null)))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("summon-help");

            properties.getRetry().setLadderOrder(List.of("reroll-seed", "REROLL_SEED"));
            assertThatThrownBy(() -> factory.resolve(manifest("idle", 8, null)))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("duplicates");
        }

        @Test
        @DisplayName("Threshold overrides outside 0..1 are refused")
        void fractionOverride() {
            assertThatThrownBy(() -> factory.resolve(manifest("idle", 8,
                    new ManifestThresholds(1.5, null, null, null, null))))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("identity-min");
        }

        @Test
        @DisplayName("Malformed palette entries are refused")
        void badPalette() {
            RunManifest manifest = new RunManifest("run_1", "knight", "idle", "idle", 8, true, "anchor.png",
                    List.of("#12345G"), null);

            assertThatThrownBy(() -> factory.resolve(manifest)).isInstanceOf(ConfigException.class);
        }
    }

    @Test
    @DisplayName("Enum values accept kebab case and upper snake case")
    void enumSpellings() {
        assertThat(PipelineSettingsFactory.enumValue(RetryAction.class, "pose-rescue", "x"))
                .isEqualTo(RetryAction.POSE_RESCUE);
        assertThat(PipelineSettingsFactory.enumValue(RetryAction.class, "POSE_RESCUE", "x"))
                .isEqualTo(RetryAction.POSE_RESCUE);
    }

    private static RunManifest manifest(String moveId, int frames, ManifestThresholds thresholds) {
        return new RunManifest("run_1", "knight", moveId, "idle", frames, true, "anchor.png", List.of(), thresholds);
    }
}
