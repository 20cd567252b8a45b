package com.framegate.domain.frame.model;

import java.nio.file.Path;
import java.util.List;

/**
 * @param debugArtifacts optional files written while validating
 */
public record AtlasValidationReport(List<AssertionResult> results, List<Path> debugArtifacts) {

    public boolean passed() {
        return results.stream().allMatch(AssertionResult::passed);
    }

    public List<AssertionResult> failures() {
        return results.stream().filter(r -> !r.passed()).toList();
    }
}
