package com.phillippitts.summarizer.service.backend;

import com.phillippitts.summarizer.domain.GenerationOptions;
import org.json.JSONObject;

import java.util.Map;

/**
 * Request and response shape of one remote chat/completion API.
 */
public interface CloudProvider {

    /** Lowercase provider id used in configuration. */
    String name();

    String defaultEndpoint();

    /** Model used when none is configured. */
    String defaultModel();

    Map<String, String> headers(String apiKey);

    JSONObject requestBody(String model, String prompt, GenerationOptions options);

    /**
     * Extracts the generated text.
     *
     * @throws com.phillippitts.summarizer.exception.BackendException when the answer carries no text
     */
    String extractText(JSONObject response);
}
