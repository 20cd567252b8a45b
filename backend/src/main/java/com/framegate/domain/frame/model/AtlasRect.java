package com.framegate.domain.frame.model;

public record AtlasRect(int x, int y, int width, int height) {
}
