package com.framegate.domain.frame.exception;

/**
 * Invalid thresholds, paths or manifest values. Raised before any frame is attempted.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
