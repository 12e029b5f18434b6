package com.qqsuccubus.fleet.core.error;

/**
 * Base exception for all coordination failures.
 * <p>
 * Every subclass models a recoverable signal returned to the immediate caller.
 * </p>
 */
public class CoordinationException extends RuntimeException {

    public CoordinationException(String message) {
        super(message);
    }

    public CoordinationException(String message, Throwable cause) {
        super(message, cause);
    }
}
