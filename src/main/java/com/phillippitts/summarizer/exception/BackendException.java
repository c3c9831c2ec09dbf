package com.phillippitts.summarizer.exception;

/**
 * Non-2xx response (or unusable payload) from a generation backend.
 */
public class BackendException extends HttpStatusException {

    private final String backendName;

    public BackendException(String backendName, int statusCode, String body) {
        super(backendName, statusCode, body);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
