package com.phillippitts.summarizer.domain;

/**
 * Per-backend readiness diagnostic with actionable text for the presentation layer.
 *
 * @param ready whether a generation request is expected to succeed
 * @param backend backend id ({@code bundled}, {@code ollama}, {@code cloud}, or {@code none})
 * @param issue what is wrong (empty when ready)
 * @param suggestion what the user should do (empty when ready)
 */
public record SetupStatus(boolean ready, String backend, String issue, String suggestion) {

    public static SetupStatus ready(BackendKind kind) {
        return new SetupStatus(true, kind.id(), "", "");
    }

    public static SetupStatus notReady(BackendKind kind, String issue, String suggestion) {
        return new SetupStatus(false, kind.id(), issue, suggestion);
    }
}
