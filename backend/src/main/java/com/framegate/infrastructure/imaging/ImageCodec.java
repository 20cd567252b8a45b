package com.framegate.infrastructure.imaging;

import com.framegate.domain.frame.model.PixelBuffer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * PNG encoding and decoding between {@link BufferedImage} and {@link PixelBuffer}.
 */
@Slf4j
@Component
public class ImageCodec {

    /**
     * Decode any ImageIO-readable image. Empty when the bytes are not a readable image.
     */
    public Optional<DecodedImage> decode(byte[] data) {
        if (data == null || data.length == 0) {
            return Optional.empty();
        }
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
            if (image == null) {
                return Optional.empty();
            }
            return Optional.of(new DecodedImage(
                    toBuffer(image),
                    image.getColorModel().hasAlpha(),
                    image.getColorModel().getNumComponents()));
        } catch (IOException | RuntimeException e) {
            log.debug("[Codec] Undecodable image ({} bytes): {}", data.length, e.getMessage());
            return Optional.empty();
        }
    }

    public byte[] encodePng(PixelBuffer buffer) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (!ImageIO.write(toImage(buffer), "png", out)) {
                throw new IllegalStateException("No PNG writer available");
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode PNG", e);
        }
    }

    public PixelBuffer toBuffer(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        PixelBuffer buffer = new PixelBuffer(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int argb = image.getRGB(x, y);
                buffer.set(x, y, (argb << 8) | (argb >>> 24));
            }
        }
        return buffer;
    }

    public BufferedImage toImage(PixelBuffer buffer) {
        BufferedImage image = new BufferedImage(buffer.width(), buffer.height(), BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < buffer.height(); y++) {
            for (int x = 0; x < buffer.width(); x++) {
                int rgba = buffer.get(x, y);
                image.setRGB(x, y, (rgba >>> 8) | (rgba << 24));
            }
        }
        return image;
    }
}
