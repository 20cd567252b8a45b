package com.framegate.infrastructure.retry;

import com.framegate.domain.frame.model.PixelBuffer;
import com.framegate.infrastructure.audit.metrics.OrphanPixelDetector;
import com.framegate.support.Sprites;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PostProcessorTest {

    private PostProcessor postProcessor;

    @BeforeEach
    void setUp() {
        postProcessor = new PostProcessor();
    }

    @Test
    @DisplayName("Semi-transparent pixels are snapped to fully opaque or fully transparent")
    void snapsAlpha() {
        PixelBuffer frame = Sprites.body(32, 16, 28, 20);
        frame.set(2, 2, PixelBuffer.pack(200, 60, 40, 60));
        frame.set(16, 10, PixelBuffer.pack(200, 60, 40, 200));

        PixelBuffer cleaned = postProcessor.cleanup(frame, List.of(0xC83C28), 30);

        assertThat(cleaned.alpha(2, 2)).isZero();
        assertThat(cleaned.alpha(16, 10)).isEqualTo(255);
    }

    @Test
    @DisplayName("Orphans are replaced by their surroundings")
    void removesOrphans() {
        PixelBuffer frame = Sprites.rect(32, 4, 4, 28, 28, Sprites.BODY);
        frame.set(10, 10, Sprites.OUTLINE);
        frame.set(20, 20, Sprites.OUTLINE);

        PixelBuffer cleaned = postProcessor.cleanup(frame, List.of(0xC83C28, 0x141414), 30);

        assertThat(new OrphanPixelDetector().compute(cleaned).count()).isZero();
        assertThat(cleaned.get(10, 10)).isEqualTo(Sprites.BODY);
    }

    @Test
    @DisplayName("Off-palette colours snap to the nearest palette entry")
    void snapsPalette() {
        PixelBuffer frame = Sprites.rect(16, 2, 2, 12, 12, PixelBuffer.pack(150, 60, 40, 255));

        PixelBuffer cleaned = postProcessor.cleanup(frame, List.of(0xC83C28, 0x141414), 30);

        assertThat(cleaned.get(5, 5)).isEqualTo(Sprites.BODY);
    }

    @Test
    @DisplayName("The input buffer is not modified")
    void inputUntouched() {
        PixelBuffer frame = Sprites.rect(16, 2, 2, 12, 12, PixelBuffer.pack(150, 60, 40, 255));
        PixelBuffer copy = frame.copy();

        postProcessor.cleanup(frame, List.of(0xC83C28), 30);

        assertThat(frame).isEqualTo(copy);
    }
}
