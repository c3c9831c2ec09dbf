package com.phillippitts.summarizer.service.backend;

import com.phillippitts.summarizer.domain.BackendKind;
import com.phillippitts.summarizer.domain.ExternalLocalParameters;
import com.phillippitts.summarizer.domain.GenerationOptions;
import com.phillippitts.summarizer.domain.SetupStatus;
import com.phillippitts.summarizer.exception.BackendException;
import com.phillippitts.summarizer.exception.ConfigurationException;
import com.phillippitts.summarizer.exception.NetworkException;
import com.phillippitts.summarizer.exception.SummarizerException;
import com.phillippitts.summarizer.service.health.HealthProbe;
import com.phillippitts.summarizer.service.http.JsonHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Generation through an already-running Ollama service. This application never owns its process.
 */
public class ExternalLocalBackend implements InferenceBackend {

    private static final Logger LOG = LogManager.getLogger(ExternalLocalBackend.class);
    private static final String BACKEND = "ollama";

    private final ExternalLocalParameters params;
    private final JsonHttpClient http;
    private final HealthProbe probe;
    private final GenerationOptions generation;

    public ExternalLocalBackend(ExternalLocalParameters params, JsonHttpClient http, HealthProbe probe,
                                GenerationOptions generation) {
        this.params = Objects.requireNonNull(params, "params");
        this.http = Objects.requireNonNull(http, "http");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.generation = Objects.requireNonNull(generation, "generation");
    }

    @Override
    public BackendKind kind() {
        return BackendKind.EXTERNAL_LOCAL;
    }

    @Override
    public String complete(String prompt) {
        requireModel();
        JSONObject body = new JSONObject()
                .put("model", params.modelIdentifier())
                .put("prompt", prompt)
                .put("stream", false);
        JSONObject response = http.postJson(BACKEND, uri("/api/generate"), body, Map.of(), generation.timeout());
        return response.optString("response", "");
    }

    @Override
    public String modelIdentifier() {
        return params.modelIdentifier() == null ? "" : params.modelIdentifier();
    }

    @Override
    public boolean isAvailable() {
        return probe.isReachable(params.hostUrl() + "/api/tags");
    }

    @Override
    public SetupStatus setupStatus() {
        List<String> installed;
        try {
            installed = listModels();
        } catch (NetworkException e) {
            return SetupStatus.notReady(kind(), "Cannot reach Ollama server",
                    "Install and start Ollama from https://ollama.com");
        } catch (BackendException e) {
            return SetupStatus.notReady(kind(), "Ollama server returned status " + e.getStatusCode(),
                    "Check Ollama server status");
        } catch (SummarizerException e) {
            LOG.debug("Could not read Ollama model list: {}", e.getMessage());
            return SetupStatus.ready(kind());
        }
        String model = modelIdentifier();
        if (!installed.contains(model)) {
            return SetupStatus.notReady(kind(), "Model '" + model + "' not found in Ollama",
                    "Run: ollama pull " + model);
        }
        return SetupStatus.ready(kind());
    }

    /**
     * Names of the models installed in the external service.
     */
    public List<String> listModels() {
        JSONObject tags = http.getJson(BACKEND, uri("/api/tags"), probe.timeout());
        List<String> names = new ArrayList<>();
        JSONArray models = tags.optJSONArray("models");
        if (models != null) {
            for (int i = 0; i < models.length(); i++) {
                JSONObject model = models.optJSONObject(i);
                if (model != null && model.has("name")) {
                    names.add(model.getString("name"));
                }
            }
        }
        return names;
    }

    /**
     * Pulls a model, reporting each NDJSON progress line. Blocks until the stream ends.
     *
     * @throws BackendException when the service rejects the pull
     * @throws NetworkException on transport failure
     */
    public void pullModel(String modelName, Consumer<PullProgress> listener) {
        if (modelName == null || modelName.isBlank()) {
            throw new ConfigurationException("inference.external.model", "model name must not be blank");
        }
        URI uri = uri("/api/pull");
        HttpRequest request = HttpRequest.newBuilder(uri)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(new JSONObject().put("name", modelName).toString(),
                        StandardCharsets.UTF_8))
                .build();

        HttpResponse<Stream<String>> response;
        try {
            response = http.httpClient().send(request, HttpResponse.BodyHandlers.ofLines());
        } catch (IOException e) {
            throw new NetworkException(uri.toString(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException(uri.toString(), e);
        }

        try (Stream<String> lines = response.body()) {
            if (response.statusCode() / 100 != 2) {
                throw new BackendException(BACKEND, response.statusCode(), String.join("\n", lines.toList()));
            }
            lines.filter(line -> !line.isBlank())
                    .map(ExternalLocalBackend::parseProgress)
                    .filter(Objects::nonNull)
                    .forEach(listener);
        } catch (UncheckedIOException e) {
            throw new NetworkException(uri.toString(), e.getCause());
        }
        LOG.info("Pulled model {} from {}", modelName, params.hostUrl());
    }

    static PullProgress parseProgress(String line) {
        try {
            JSONObject json = new JSONObject(line);
            return PullProgress.of(json.optString("status", ""), json.optString("digest", ""),
                    json.optLong("total", 0), json.optLong("completed", 0));
        } catch (JSONException e) {
            LOG.debug("Skipping malformed pull progress line: {}", e.getMessage());
            return null;
        }
    }

    public ExternalLocalParameters parameters() {
        return params;
    }

    private void requireModel() {
        if (params.modelIdentifier() == null || params.modelIdentifier().isBlank()) {
            throw new ConfigurationException("inference.external.model", "Ollama model is not configured");
        }
    }

    private URI uri(String path) {
        return URI.create(params.hostUrl() + path);
    }
}
