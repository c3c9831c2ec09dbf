package com.phillippitts.summarizer.domain;

import com.phillippitts.summarizer.util.LogSanitizer;

/**
 * Hosted provider settings.
 *
 * @param providerName {@code anthropic} or {@code openai}
 * @param apiKey provider API key; blank means not configured
 * @param modelIdentifier provider model name
 * @param customEndpoint optional URL overriding the provider default (may be null)
 */
public record RemoteCloudParameters(
        String providerName,
        String apiKey,
        String modelIdentifier,
        String customEndpoint
) implements BackendSettings {

    @Override
    public BackendKind kind() {
        return BackendKind.REMOTE_CLOUD;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public boolean hasCustomEndpoint() {
        return customEndpoint != null && !customEndpoint.isBlank();
    }

    /**
     * Masks the key so the record can be logged safely.
     */
    @Override
    public String toString() {
        return "RemoteCloudParameters[providerName=" + providerName
                + ", apiKey=" + (hasApiKey() ? LogSanitizer.maskSecret(apiKey) : "<none>")
                + ", modelIdentifier=" + modelIdentifier
                + ", customEndpoint=" + customEndpoint + "]";
    }
}
