package com.framegate.domain.frame.model;

import java.util.Map;

/**
 * @param frames frame key to rectangle, in frame order
 */
public record PackedAtlas(PixelBuffer image, Map<String, AtlasRect> frames) {
}
