package com.phillippitts.summarizer.exception;

/**
 * Thrown when a generation backend cannot serve a request.
 * This covers the bundled process lifecycle (spawn failure, early exit) as well as
 * malformed backend payloads.
 */
public class InferenceException extends SummarizerException {

    private final String backendName;

    public InferenceException(String message) {
        super(message);
        this.backendName = "unknown";
    }

    public InferenceException(String message, String backendName) {
        super(message + " (backend: " + backendName + ")");
        this.backendName = backendName;
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
        this.backendName = "unknown";
    }

    public InferenceException(String message, String backendName, Throwable cause) {
        super(message + " (backend: " + backendName + ")", cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
