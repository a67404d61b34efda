package com.wifi.emitter.positioning.exception;

/**
 * Exception thrown when the emitter store cannot read or commit rows.
 */
public class EmitterPersistenceException extends RuntimeException {

    public EmitterPersistenceException(String message) {
        super(message);
    }

    public EmitterPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
