package com.coherenceai.infrastructure.persistence;

/**
 * The knowledge store could not be written. Handled by the write dispatcher, never surfaced to callers.
 */
public class PersistenceUnavailableException extends RuntimeException {

    public PersistenceUnavailableException(String message) {
        super(message);
    }

    public PersistenceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
