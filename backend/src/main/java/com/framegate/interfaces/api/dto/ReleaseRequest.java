package com.framegate.interfaces.api.dto;

public record ReleaseRequest(boolean override) {}
