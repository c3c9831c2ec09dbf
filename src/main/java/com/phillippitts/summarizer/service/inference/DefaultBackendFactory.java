package com.phillippitts.summarizer.service.inference;

import com.phillippitts.summarizer.domain.BackendSettings;
import com.phillippitts.summarizer.domain.BundledParameters;
import com.phillippitts.summarizer.domain.ExternalLocalParameters;
import com.phillippitts.summarizer.domain.GenerationOptions;
import com.phillippitts.summarizer.domain.RemoteCloudParameters;
import com.phillippitts.summarizer.exception.ConfigurationException;
import com.phillippitts.summarizer.service.backend.BundledBackend;
import com.phillippitts.summarizer.service.backend.ExternalLocalBackend;
import com.phillippitts.summarizer.service.backend.InferenceBackend;
import com.phillippitts.summarizer.service.backend.RemoteCloudBackend;
import com.phillippitts.summarizer.service.health.HealthProbe;
import com.phillippitts.summarizer.service.http.JsonHttpClient;

import java.util.Objects;

/**
 * Maps each settings variant to its backend. Only the bundled variant creates a process manager.
 */
public class DefaultBackendFactory implements BackendFactory {

    private final BundledManagerFactory bundledManagers;
    private final JsonHttpClient http;
    private final HealthProbe probe;
    private final GenerationOptions generation;

    public DefaultBackendFactory(BundledManagerFactory bundledManagers, JsonHttpClient http, HealthProbe probe,
                                 GenerationOptions generation) {
        this.bundledManagers = Objects.requireNonNull(bundledManagers, "bundledManagers");
        this.http = Objects.requireNonNull(http, "http");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.generation = Objects.requireNonNull(generation, "generation");
    }

    @Override
    public InferenceBackend create(BackendSettings settings) {
        if (settings instanceof BundledParameters bundled) {
            return new BundledBackend(bundledManagers.create(bundled));
        }
        if (settings instanceof ExternalLocalParameters external) {
            return new ExternalLocalBackend(external, http, probe, generation);
        }
        if (settings instanceof RemoteCloudParameters cloud) {
            return new RemoteCloudBackend(cloud, http, generation);
        }
        throw new ConfigurationException("inference.backend", "unsupported backend settings: " + settings);
    }
}
