package com.framegate.infrastructure.audit.metrics;

import java.util.List;

/**
 * @param locations first orphan coordinates as {x, y}, at most 50
 */
public record OrphanReport(int count, List<int[]> locations) {
}
