package com.phillippitts.summarizer.service.backend;

import com.phillippitts.summarizer.domain.GenerationOptions;
import com.phillippitts.summarizer.exception.BackendException;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Map;

/**
 * OpenAI Chat Completions API: {@code choices[0].message.content}.
 */
final class OpenAiProvider implements CloudProvider {

    static final String NAME = "openai";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String defaultEndpoint() {
        return "https://api.openai.com/v1/chat/completions";
    }

    @Override
    public String defaultModel() {
        return "gpt-4o-mini";
    }

    @Override
    public Map<String, String> headers(String apiKey) {
        return Map.of("Authorization", "Bearer " + apiKey);
    }

    @Override
    public JSONObject requestBody(String model, String prompt, GenerationOptions options) {
        return new JSONObject()
                .put("model", model)
                .put("messages", new JSONArray().put(new JSONObject()
                        .put("role", "user")
                        .put("content", prompt)));
    }

    @Override
    public String extractText(JSONObject response) {
        JSONArray choices = response.optJSONArray("choices");
        if (choices == null || choices.isEmpty()) {
            throw new BackendException(NAME, 200, "empty response from OpenAI");
        }
        JSONObject first = choices.optJSONObject(0);
        JSONObject message = first == null ? null : first.optJSONObject("message");
        return message == null ? "" : message.optString("content", "");
    }
}
