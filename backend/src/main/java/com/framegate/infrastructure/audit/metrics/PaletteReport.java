package com.framegate.infrastructure.audit.metrics;

import java.util.List;

/**
 * @param topOffPalette most frequent unmatched colours as {@code #RRGGBB}, at most 10
 */
public record PaletteReport(double fidelity, int opaquePixels, int matchedPixels, List<String> topOffPalette) {
}
