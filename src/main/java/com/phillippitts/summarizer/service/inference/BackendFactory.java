package com.phillippitts.summarizer.service.inference;

import com.phillippitts.summarizer.domain.BackendSettings;
import com.phillippitts.summarizer.service.backend.InferenceBackend;

/**
 * Builds the backend matching a configuration variant.
 */
@FunctionalInterface
public interface BackendFactory {

    InferenceBackend create(BackendSettings settings);
}
