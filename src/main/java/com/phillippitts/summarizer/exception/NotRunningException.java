package com.phillippitts.summarizer.exception;

/**
 * Generation was attempted against a bundled server that has not been started.
 */
public class NotRunningException extends InferenceException {

    public NotRunningException() {
        super("bundled server is not running", "bundled");
    }
}
