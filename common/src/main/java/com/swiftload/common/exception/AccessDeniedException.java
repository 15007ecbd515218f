package com.swiftload.common.exception;

/**
 * Exception thrown when a user lacks the role or ownership an action requires
 * HTTP Status: 403 Forbidden (set in GlobalExceptionHandler)
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
