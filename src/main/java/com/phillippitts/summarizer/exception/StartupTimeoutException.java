package com.phillippitts.summarizer.exception;

import java.time.Duration;

/**
 * The bundled server did not report healthy within the startup ceiling.
 * The process has already been stopped when this is thrown.
 */
public class StartupTimeoutException extends InferenceException {

    private final Duration timeout;

    public StartupTimeoutException(Duration timeout) {
        super("llama server failed to start within " + timeout.toSeconds() + " seconds", "bundled");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
