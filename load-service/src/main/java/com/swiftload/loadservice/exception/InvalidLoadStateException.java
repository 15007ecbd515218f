package com.swiftload.loadservice.exception;

/**
 * Exception thrown when an action is not legal in the current state of a load or bid.
 * For example: accepting a bid on a load that is already ASSIGNED, or losing a
 * concurrent accept/cancel race.
 * HTTP Status: 422 Unprocessable Entity
 */
public class InvalidLoadStateException extends RuntimeException {

    public InvalidLoadStateException(String message) {
        super(message);
    }

    public InvalidLoadStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
