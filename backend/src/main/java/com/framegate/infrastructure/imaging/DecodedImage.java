package com.framegate.infrastructure.imaging;

import com.framegate.domain.frame.model.PixelBuffer;

/**
 * @param hasAlpha whether the source carried an alpha channel
 * @param channels colour components of the source colour model
 */
public record DecodedImage(PixelBuffer pixels, boolean hasAlpha, int channels) {
}
