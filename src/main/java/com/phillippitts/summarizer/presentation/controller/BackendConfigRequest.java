package com.phillippitts.summarizer.presentation.controller;

import com.phillippitts.summarizer.config.inference.InferenceProperties;
import com.phillippitts.summarizer.domain.BackendKind;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body of {@code PUT /api/v1/inference/config}. Only the fields of the selected backend are
 * read; omitted fields keep their configured defaults.
 */
public record BackendConfigRequest(
        @NotBlank String backend,
        String modelId,
        String modelPath,
        String serverPath,
        @Min(1) @Max(65535) Integer port,
        @Min(1) Integer contextSize,
        @Min(0) Integer gpuLayers,
        String host,
        String model,
        String provider,
        String apiKey,
        String endpoint
) {

    /**
     * Overlays this request on a fresh set of defaults.
     *
     * @throws IllegalArgumentException for an unknown backend name
     */
    public InferenceProperties toProperties() {
        InferenceProperties props = new InferenceProperties();
        props.setBackend(BackendKind.fromString(backend));

        InferenceProperties.Bundled bundled = props.getBundled();
        if (modelId != null) {
            bundled.setModelId(modelId);
        }
        bundled.setModelPath(modelPath);
        bundled.setServerPath(serverPath);
        if (port != null) {
            bundled.setPort(port);
        }
        if (contextSize != null) {
            bundled.setContextSize(contextSize);
        }
        if (gpuLayers != null) {
            bundled.setGpuLayers(gpuLayers);
        }

        if (host != null) {
            props.getExternal().setHost(host);
        }
        if (model != null) {
            props.getExternal().setModel(model);
            props.getCloud().setModel(model);
        }

        if (provider != null) {
            props.getCloud().setProvider(provider);
        }
        props.getCloud().setApiKey(apiKey);
        props.getCloud().setEndpoint(endpoint);
        return props;
    }
}
