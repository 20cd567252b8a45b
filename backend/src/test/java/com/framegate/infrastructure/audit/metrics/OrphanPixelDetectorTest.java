package com.framegate.infrastructure.audit.metrics;

import com.framegate.domain.frame.model.PixelBuffer;
import com.framegate.support.Sprites;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OrphanPixelDetectorTest {

    private OrphanPixelDetector detector;

    @BeforeEach
    void setUp() {
        detector = new OrphanPixelDetector();
    }

    @Test
    @DisplayName("16 isolated specks on a 128x128 canvas are all counted")
    void sixteenSpecks() {
        PixelBuffer buffer = Sprites.canvas(128);
        for (int i = 0; i < 16; i++) {
            buffer.set(5 + 7 * i, 5 + 7 * i, Sprites.OUTLINE);
        }

        OrphanReport report = detector.compute(buffer);

        assertThat(report.count()).isEqualTo(16);
        assertThat(report.locations()).hasSize(16);
    }

    @Test
    @DisplayName("Solid regions and border pixels are not orphans")
    void solidRegion() {
        PixelBuffer buffer = Sprites.rect(32, 4, 4, 20, 20, Sprites.BODY);
        buffer.set(0, 0, Sprites.OUTLINE);

        assertThat(detector.compute(buffer).count()).isZero();
    }

    @Test
    @DisplayName("A pixel surrounded by a different colour is an orphan")
    void differentColourNeighbours() {
        PixelBuffer buffer = Sprites.rect(16, 2, 2, 12, 12, Sprites.BODY);
        buffer.set(7, 7, Sprites.OUTLINE);

        assertThat(detector.compute(buffer).count()).isEqualTo(1);
    }
}
