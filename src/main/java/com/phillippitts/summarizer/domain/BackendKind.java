package com.phillippitts.summarizer.domain;

import java.util.Locale;

/**
 * The three interchangeable generation backends. Exactly one is active at a time.
 */
public enum BackendKind {
    /** Completion server spawned and owned by this application. */
    BUNDLED("bundled"),
    /** Already-running local service (Ollama API); no process ownership. */
    EXTERNAL_LOCAL("ollama"),
    /** Hosted provider reached over HTTPS with an API key. */
    REMOTE_CLOUD("cloud");

    private final String id;

    BackendKind(String id) {
        this.id = id;
    }

    /**
     * Stable lowercase identifier used in logs, metrics tags and status payloads.
     */
    public String id() {
        return id;
    }

    /**
     * Resolves either the enum name ({@code EXTERNAL_LOCAL}, {@code external-local}) or the short id
     * ({@code ollama}).
     *
     * @throws IllegalArgumentException when nothing matches
     */
    public static BackendKind fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("backend must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (BackendKind kind : values()) {
            if (kind.name().equals(normalized) || kind.id.equalsIgnoreCase(value.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown inference backend: " + value);
    }
}
