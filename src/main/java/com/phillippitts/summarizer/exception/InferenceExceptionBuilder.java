package com.phillippitts.summarizer.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link InferenceException} with rich contextual information.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw InferenceExceptionBuilder.create("llama server exited during startup")
 *         .backend("bundled")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("port", 18080)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class InferenceExceptionBuilder {

    private final String message;
    private String backendName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private InferenceExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static InferenceExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new InferenceExceptionBuilder(message);
    }

    public InferenceExceptionBuilder backend(String backendName) {
        this.backendName = backendName;
        return this;
    }

    public InferenceExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the process exit code (for subprocess failures).
     *
     * @param exitCode process exit code
     * @return this builder for chaining
     */
    public InferenceExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public InferenceExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public InferenceExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The final message format is:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (backend: {backend})
     * </pre>
     *
     * @return constructed InferenceException
     */
    public InferenceException build() {
        String detailedMessage = buildDetailedMessage();
        String backend = backendName != null ? backendName : "unknown";

        if (cause != null) {
            return new InferenceException(detailedMessage, backend, cause);
        }
        return new InferenceException(detailedMessage, backend);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        return sb.append(")").toString();
    }
}
