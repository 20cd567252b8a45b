package com.framegate.domain.frame.model;

public record AssertionResult(AtlasAssertion assertion, boolean passed, String message) {
}
