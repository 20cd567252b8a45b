package com.framegate.infrastructure.export;

import com.framegate.domain.frame.exception.PackagingException;
import com.framegate.domain.frame.model.AtlasFrame;
import com.framegate.domain.frame.model.AtlasRect;
import com.framegate.domain.frame.model.PackedAtlas;
import com.framegate.domain.frame.model.PixelBuffer;
import com.framegate.domain.frame.service.PackerAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Packs equally sized frames into a near-square grid, row-major in frame order, without padding
 * or trimming so every frame keeps the same pivot.
 */
@Slf4j
@Component
public class GridAtlasPacker implements PackerAdapter {

    @Override
    public PackedAtlas pack(List<AtlasFrame> frames) {
        if (frames.isEmpty()) {
            throw new PackagingException("No frames to pack");
        }
        int cellWidth = frames.get(0).image().width();
        int cellHeight = frames.get(0).image().height();
        for (AtlasFrame frame : frames) {
            if (frame.image().width() != cellWidth || frame.image().height() != cellHeight) {
                throw new PackagingException("Frame " + frame.name() + " is " + frame.image().width() + "x"
                        + frame.image().height() + ", expected " + cellWidth + "x" + cellHeight);
            }
        }

        int columns = (int) Math.ceil(Math.sqrt(frames.size()));
        int rows = (int) Math.ceil((double) frames.size() / columns);
        PixelBuffer atlas = new PixelBuffer(columns * cellWidth, rows * cellHeight);
        Map<String, AtlasRect> rects = new LinkedHashMap<>();

        for (int i = 0; i < frames.size(); i++) {
            AtlasFrame frame = frames.get(i);
            int ox = (i % columns) * cellWidth;
            int oy = (i / columns) * cellHeight;
            for (int y = 0; y < cellHeight; y++) {
                for (int x = 0; x < cellWidth; x++) {
                    atlas.set(ox + x, oy + y, frame.image().get(x, y));
                }
            }
            if (rects.put(frame.name(), new AtlasRect(ox, oy, cellWidth, cellHeight)) != null) {
                throw new PackagingException("Duplicate frame name " + frame.name());
            }
        }

        log.info("[Packer] Packed {} frames into {}x{} grid ({}x{} px)",
                frames.size(), columns, rows, atlas.width(), atlas.height());
        return new PackedAtlas(atlas, rects);
    }

    /** Copies one frame back out of an atlas. */
    public static PixelBuffer crop(PixelBuffer atlas, AtlasRect rect) {
        PixelBuffer out = new PixelBuffer(rect.width(), rect.height());
        for (int y = 0; y < rect.height(); y++) {
            for (int x = 0; x < rect.width(); x++) {
                out.set(x, y, atlas.get(rect.x() + x, rect.y() + y));
            }
        }
        return out;
    }
}
