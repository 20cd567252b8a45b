package com.framegate.interfaces.api.dto;

public record RunStartedResponse(String runId, String statusUrl) {}
