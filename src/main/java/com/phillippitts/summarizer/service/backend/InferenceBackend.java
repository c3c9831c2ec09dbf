package com.phillippitts.summarizer.service.backend;

import com.phillippitts.summarizer.domain.BackendKind;
import com.phillippitts.summarizer.domain.SetupStatus;

/**
 * One generation provider behind the inference service.
 *
 * <p>Implementations normalize their provider's response shape to a single text value that is
 * handed to {@link com.phillippitts.summarizer.service.prompt.PromptCodec#parseResponse(String)}.
 *
 * <p>Thread Safety: implementations must allow concurrent {@link #complete(String)} calls.
 */
public interface InferenceBackend extends AutoCloseable {

    BackendKind kind();

    /**
     * Sends the prompt and returns the raw generated text.
     *
     * @throws com.phillippitts.summarizer.exception.ConfigurationException when the backend is misconfigured
     * @throws com.phillippitts.summarizer.exception.BackendException on a non-2xx answer
     * @throws com.phillippitts.summarizer.exception.NetworkException on transport failure
     */
    String complete(String prompt);

    /**
     * Identifier recorded as {@code modelUsed} on results.
     */
    String modelIdentifier();

    /**
     * Cheap readiness check used by status reporting. Must not start or stop anything.
     */
    boolean isAvailable();

    /**
     * Actionable diagnostic for the current configuration. Read-only.
     */
    SetupStatus setupStatus();

    /**
     * Releases resources owned by the backend. Default is a no-op.
     */
    @Override
    default void close() {
    }
}
