package com.framegate.infrastructure.audit.metrics;

/**
 * @param verticalDrift   frame bottomY minus anchor baselineY; positive sinks, negative floats
 * @param horizontalDrift frame rootX minus anchor rootX
 * @param residual        larger of the two absolute drifts
 */
public record DriftReport(int verticalDrift, int horizontalDrift, int residual) {
}
