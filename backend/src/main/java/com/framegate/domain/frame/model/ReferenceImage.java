package com.framegate.domain.frame.model;

public record ReferenceImage(ReferenceRole role, PixelBuffer image) {
}
