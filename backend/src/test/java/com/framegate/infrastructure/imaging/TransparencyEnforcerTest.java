package com.framegate.infrastructure.imaging;

import com.framegate.domain.frame.model.PixelBuffer;
import com.framegate.domain.frame.model.ReasonCode;
import com.framegate.domain.frame.model.TransparencyConfig;
import com.framegate.domain.frame.model.TransparencyStrategy;
import com.framegate.support.Sprites;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TransparencyEnforcerTest {

    private static final int GREEN = PixelBuffer.pack(0, 255, 0, 255);

    private final TransparencyEnforcer enforcer = new TransparencyEnforcer();
    private final TransparencyConfig chromaKey =
            new TransparencyConfig(TransparencyStrategy.CHROMA_KEY, TransparencyConfig.DEFAULT_CHROMA, 30);

    @Test
    @DisplayName("True alpha passes RGBA candidates through untouched")
    void trueAlphaPassesThrough() {
        PixelBuffer pixels = Sprites.body(16, 8, 14, 6);

        TransparencyOutcome outcome = enforcer.enforce(new DecodedImage(pixels, true, 4), TransparencyConfig.trueAlpha());

        assertThat(outcome.failure()).isNull();
        assertThat(outcome.buffer()).isSameAs(pixels);
        assertThat(outcome.removed()).isZero();
    }

    @Test
    @DisplayName("True alpha rejects candidates without an alpha channel")
    void trueAlphaRequiresAlpha() {
        TransparencyOutcome outcome = enforcer.enforce(
                new DecodedImage(Sprites.body(16, 8, 14, 6), false, 3), TransparencyConfig.trueAlpha());

        assertThat(outcome.failure()).isEqualTo(ReasonCode.HF04_WRONG_COLOR_DEPTH);
        assertThat(outcome.buffer()).isNull();
    }

    @Test
    @DisplayName("Chroma key clears background pixels and keeps the sprite")
    void chromaKeyRemovesBackground() {
        PixelBuffer pixels = Sprites.canvas(16);
        Sprites.fill(pixels, 0, 0, 15, 15, GREEN);
        Sprites.fill(pixels, 4, 4, 11, 11, Sprites.BODY);

        TransparencyOutcome outcome = enforcer.enforce(new DecodedImage(pixels, true, 4), chromaKey);

        assertThat(outcome.failure()).isNull();
        assertThat(outcome.removed()).isEqualTo(256 - 64);
        assertThat(outcome.buffer().get(0, 0)).isZero();
        assertThat(outcome.buffer().get(8, 8)).isEqualTo(Sprites.BODY);
        assertThat(outcome.fringeRisk()).isFalse();
        assertThat(pixels.get(0, 0)).as("source is not mutated").isEqualTo(GREEN);
    }

    @Test
    @DisplayName("Near-key colours left on the sprite are reported as fringe risk")
    void chromaKeyFringeRisk() {
        PixelBuffer pixels = Sprites.canvas(16);
        Sprites.fill(pixels, 0, 0, 15, 15, GREEN);
        Sprites.fill(pixels, 4, 4, 11, 7, PixelBuffer.pack(0, 215, 0, 255));
        Sprites.fill(pixels, 4, 8, 11, 11, Sprites.BODY);

        TransparencyOutcome outcome = enforcer.enforce(new DecodedImage(pixels, true, 4), chromaKey);

        assertThat(outcome.fringeRatio()).isEqualTo(0.5);
        assertThat(outcome.fringeRisk()).isTrue();
    }
}
