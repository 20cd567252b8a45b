package com.framegate.infrastructure.imaging;

import com.framegate.domain.frame.model.PixelBuffer;
import org.springframework.stereotype.Component;

/**
 * Nearest-neighbour resizing. No smoothing kernel is ever applied, so anti-aliased generator
 * edges collapse onto a crisp pixel grid instead of blurring.
 */
@Component
public class Downsampler {

    public PixelBuffer downsample(PixelBuffer source, int targetSize) {
        return resize(source, targetSize, targetSize);
    }

    public PixelBuffer resize(PixelBuffer source, int targetWidth, int targetHeight) {
        PixelBuffer result = new PixelBuffer(targetWidth, targetHeight);
        for (int y = 0; y < targetHeight; y++) {
            int srcY = (int) ((long) y * source.height() / targetHeight);
            for (int x = 0; x < targetWidth; x++) {
                int srcX = (int) ((long) x * source.width() / targetWidth);
                result.set(x, y, source.get(srcX, srcY));
            }
        }
        return result;
    }

    public PixelBuffer upscale(PixelBuffer source, int factor) {
        return resize(source, source.width() * factor, source.height() * factor);
    }
}
