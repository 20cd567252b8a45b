package com.framegate.infrastructure.audit.metrics;

public record HaloReport(int edgePixels, int haloPixels, double ratio) {
}
