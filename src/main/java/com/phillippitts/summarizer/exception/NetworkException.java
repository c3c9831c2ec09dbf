package com.phillippitts.summarizer.exception;

/**
 * Transport-level failure talking to an HTTP dependency (connection refused, timeout, reset).
 * Always wraps the underlying cause.
 */
public class NetworkException extends SummarizerException {

    private final String target;

    public NetworkException(String target, Throwable cause) {
        super("Failed to reach " + target + ": " + describe(cause), cause);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String msg = cause.getMessage();
        return msg == null || msg.isBlank() ? cause.getClass().getSimpleName() : msg;
    }
}
