package com.phillippitts.summarizer.service.backend;

import com.phillippitts.summarizer.domain.BackendKind;
import com.phillippitts.summarizer.domain.GenerationOptions;
import com.phillippitts.summarizer.domain.RemoteCloudParameters;
import com.phillippitts.summarizer.domain.SetupStatus;
import com.phillippitts.summarizer.exception.ConfigurationException;
import com.phillippitts.summarizer.service.http.JsonHttpClient;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/**
 * Generation through a remote provider's chat/completion endpoint.
 *
 * <p>The provider is resolved per call so that an unknown provider surfaces as a
 * {@link ConfigurationException} from {@link #complete(String)} and as a diagnostic from
 * {@link #setupStatus()}, not as a construction failure.
 */
public class RemoteCloudBackend implements InferenceBackend {

    private final RemoteCloudParameters params;
    private final JsonHttpClient http;
    private final GenerationOptions generation;

    public RemoteCloudBackend(RemoteCloudParameters params, JsonHttpClient http, GenerationOptions generation) {
        this.params = Objects.requireNonNull(params, "params");
        this.http = Objects.requireNonNull(http, "http");
        this.generation = Objects.requireNonNull(generation, "generation");
    }

    @Override
    public BackendKind kind() {
        return BackendKind.REMOTE_CLOUD;
    }

    @Override
    public String complete(String prompt) {
        CloudProvider provider = requireProvider();
        if (!params.hasApiKey()) {
            throw new ConfigurationException("inference.cloud.api-key", "API key not configured");
        }
        URI endpoint = URI.create(params.hasCustomEndpoint() ? params.customEndpoint().trim() : provider.defaultEndpoint());
        return provider.extractText(http.postJson(
                provider.name(),
                endpoint,
                provider.requestBody(resolveModel(provider), prompt, generation),
                provider.headers(params.apiKey()),
                generation.timeout()));
    }

    @Override
    public String modelIdentifier() {
        return provider().map(this::resolveModel).orElseGet(() -> Objects.requireNonNullElse(params.modelIdentifier(), ""));
    }

    @Override
    public boolean isAvailable() {
        return params.hasApiKey() && provider().isPresent();
    }

    @Override
    public SetupStatus setupStatus() {
        if (!params.hasApiKey()) {
            return SetupStatus.notReady(kind(), "API key not configured", "Add API key in Settings > AI");
        }
        if (provider().isEmpty()) {
            return SetupStatus.notReady(kind(), "Unknown cloud provider: " + params.providerName(),
                    "Select " + String.join(" or ", CloudProviders.names()));
        }
        return SetupStatus.ready(kind());
    }

    public RemoteCloudParameters parameters() {
        return params;
    }

    private Optional<CloudProvider> provider() {
        return CloudProviders.forName(params.providerName());
    }

    private CloudProvider requireProvider() {
        return provider().orElseThrow(() -> new ConfigurationException("inference.cloud.provider",
                "unknown cloud provider: " + params.providerName()));
    }

    private String resolveModel(CloudProvider provider) {
        String model = params.modelIdentifier();
        return model == null || model.isBlank() ? provider.defaultModel() : model.trim();
    }
}
