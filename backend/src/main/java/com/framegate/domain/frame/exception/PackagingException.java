package com.framegate.domain.frame.exception;

/**
 * Packer or validator failure. Never invalidates frames that were already approved.
 */
public class PackagingException extends RuntimeException {

    public PackagingException(String message) {
        super(message);
    }

    public PackagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
