package com.phillippitts.summarizer.exception;

/**
 * The configured port is bound by something that does not answer the health check.
 * Fatal to {@code start()}.
 */
public class PortConflictException extends InferenceException {

    private final int port;

    public PortConflictException(int port) {
        super("Port " + port + " is already in use by another process", "bundled");
        this.port = port;
    }

    public int getPort() {
        return port;
    }
}
