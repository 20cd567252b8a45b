package com.framegate.infrastructure.export;

import com.framegate.domain.frame.exception.PackagingException;
import com.framegate.domain.frame.model.AtlasFrame;
import com.framegate.domain.frame.model.AtlasRect;
import com.framegate.domain.frame.model.PackedAtlas;
import com.framegate.domain.frame.model.PixelBuffer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.framegate.support.Sprites.BODY;
import static com.framegate.support.Sprites.body;
import static com.framegate.support.Sprites.canvas;
import static com.framegate.support.Sprites.rect;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GridAtlasPackerTest {

    private final GridAtlasPacker packer = new GridAtlasPacker();

    @Test
    @DisplayName("Five frames pack row-major into a 3x2 grid in frame order")
    void packsNearSquareGrid() {
        List<AtlasFrame> frames = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            frames.add(new AtlasFrame(FrameNaming.frameKey("walk", i), body(16, 8, 14, 6)));
        }

        PackedAtlas atlas = packer.pack(frames);

        assertThat(atlas.image().width()).isEqualTo(48);
        assertThat(atlas.image().height()).isEqualTo(32);
        assertThat(atlas.frames().keySet()).containsExactly(
                "walk/0000", "walk/0001", "walk/0002", "walk/0003", "walk/0004");
        assertThat(atlas.frames().get("walk/0004")).isEqualTo(new AtlasRect(16, 16, 16, 16));
    }

    @Test
    @DisplayName("Cropping a rectangle returns the original frame pixels")
    void cropRestoresFrame() {
        PixelBuffer second = rect(16, 2, 2, 5, 5, BODY);
        PackedAtlas atlas = packer.pack(List.of(
                new AtlasFrame("idle/0000", canvas(16)),
                new AtlasFrame("idle/0001", second)));

        assertThat(GridAtlasPacker.crop(atlas.image(), atlas.frames().get("idle/0001"))).isEqualTo(second);
    }

    @Test
    @DisplayName("Mixed frame sizes, duplicates and empty input are packaging failures")
    void packagingFailures() {
        assertThatThrownBy(() -> packer.pack(List.of()))
                .isInstanceOf(PackagingException.class);
        assertThatThrownBy(() -> packer.pack(List.of(
                new AtlasFrame("idle/0000", canvas(16)), new AtlasFrame("idle/0001", canvas(8)))))
                .isInstanceOf(PackagingException.class)
                .hasMessageContaining("idle/0001");
        assertThatThrownBy(() -> packer.pack(List.of(
                new AtlasFrame("idle/0000", canvas(16)), new AtlasFrame("idle/0000", canvas(16)))))
                .isInstanceOf(PackagingException.class)
                .hasMessageContaining("Duplicate");
    }
}
