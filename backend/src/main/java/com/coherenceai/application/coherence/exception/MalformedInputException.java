package com.coherenceai.application.coherence.exception;

/**
 * A required part of the analyzer output is missing or out of range. The request is rejected as a whole.
 */
public class MalformedInputException extends RuntimeException {

    public MalformedInputException(String message) {
        super(message);
    }
}
