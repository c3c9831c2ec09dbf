package com.phillippitts.summarizer.exception;

/**
 * Thrown when an HTTP dependency answers with a non-2xx status.
 * Carries the status code and a (possibly truncated) response body for diagnostics.
 */
public class HttpStatusException extends SummarizerException {

    private static final int MAX_BODY_CHARS = 500;

    private final int statusCode;
    private final String body;

    public HttpStatusException(String source, int statusCode, String body) {
        super(source + " returned status " + statusCode + bodySuffix(body));
        this.statusCode = statusCode;
        this.body = body == null ? "" : body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    private static String bodySuffix(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        if (trimmed.length() > MAX_BODY_CHARS) {
            trimmed = trimmed.substring(0, MAX_BODY_CHARS) + "...";
        }
        return ": " + trimmed;
    }
}
