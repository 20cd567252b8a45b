package com.framegate.infrastructure.export;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameNamingTest {

    @Test
    @DisplayName("Keys are the move id and a four-digit zero-padded index")
    void frameKey() {
        assertThat(FrameNaming.frameKey("idle", 0)).isEqualTo("idle/0000");
        assertThat(FrameNaming.frameKey("light_punch", 42)).isEqualTo("light_punch/0042");
        assertThat(FrameNaming.indexOf("light_punch/0042")).isEqualTo(42);
    }

    @Test
    @DisplayName("Indices beyond four digits are refused")
    void indexOutOfRange() {
        assertThatThrownBy(() -> FrameNaming.frameKey("idle", 10_000))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Idle/0000", "idle/000", "idle-0000", "idle/00001", "walk2/0001"})
    @DisplayName("Malformed keys are invalid")
    void invalidKeys(String key) {
        assertThat(FrameNaming.isValidKey(key)).isFalse();
    }

    @Test
    @DisplayName("Gaps are the missing indices below the highest present one")
    void findGaps() {
        assertThat(FrameNaming.findGaps(List.of("idle/0000", "idle/0003", "idle/0001"))).containsExactly(2);
        assertThat(FrameNaming.findGaps(List.of("idle/0000", "idle/0001"))).isEmpty();
        assertThat(FrameNaming.findGaps(List.of())).isEmpty();
    }
}
