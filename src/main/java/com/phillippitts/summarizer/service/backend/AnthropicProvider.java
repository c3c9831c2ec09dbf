package com.phillippitts.summarizer.service.backend;

import com.phillippitts.summarizer.domain.GenerationOptions;
import com.phillippitts.summarizer.exception.BackendException;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Map;

/**
 * Anthropic Messages API: {@code content[0].text}.
 */
final class AnthropicProvider implements CloudProvider {

    static final String NAME = "anthropic";
    static final String API_VERSION = "2023-06-01";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String defaultEndpoint() {
        return "https://api.anthropic.com/v1/messages";
    }

    @Override
    public String defaultModel() {
        return "claude-3-5-haiku-latest";
    }

    @Override
    public Map<String, String> headers(String apiKey) {
        return Map.of("x-api-key", apiKey, "anthropic-version", API_VERSION);
    }

    @Override
    public JSONObject requestBody(String model, String prompt, GenerationOptions options) {
        return new JSONObject()
                .put("model", model)
                .put("max_tokens", options.maxTokens())
                .put("messages", new JSONArray().put(new JSONObject()
                        .put("role", "user")
                        .put("content", prompt)));
    }

    @Override
    public String extractText(JSONObject response) {
        JSONArray content = response.optJSONArray("content");
        if (content == null || content.isEmpty()) {
            throw new BackendException(NAME, 200, "empty response from Anthropic");
        }
        JSONObject first = content.optJSONObject(0);
        return first == null ? "" : first.optString("text", "");
    }
}
