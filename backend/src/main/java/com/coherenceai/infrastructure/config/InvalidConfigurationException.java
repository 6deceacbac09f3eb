package com.coherenceai.infrastructure.config;

/**
 * Engine configuration rejected at load time. The previously active configuration stays in place.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
