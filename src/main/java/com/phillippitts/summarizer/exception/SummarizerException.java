package com.phillippitts.summarizer.exception;

/**
 * Base exception for all session-summarizer application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SummarizerException extends RuntimeException {

    public SummarizerException(String message) {
        super(message);
    }

    public SummarizerException(String message, Throwable cause) {
        super(message, cause);
    }

    public SummarizerException(Throwable cause) {
        super(cause);
    }
}
