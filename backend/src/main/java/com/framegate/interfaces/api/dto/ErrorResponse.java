package com.framegate.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
