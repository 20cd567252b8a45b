package com.framegate.domain.frame.model;

/**
 * @param name frame key, {@code {moveId}/{0000}}
 */
public record AtlasFrame(String name, PixelBuffer image) {
}
