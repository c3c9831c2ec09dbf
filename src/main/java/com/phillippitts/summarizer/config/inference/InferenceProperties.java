package com.phillippitts.summarizer.config.inference;

import com.phillippitts.summarizer.domain.BackendKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed properties for the inference layer. Binds to properties prefixed with "inference".
 *
 * <p>Example application.properties:
 * <pre>
 * inference.backend=bundled
 * inference.bundled.port=18080
 * inference.bundled.context-size=2048
 * inference.external.host=http://localhost:11434
 * inference.external.model=qwen2.5:7b
 * inference.cloud.provider=anthropic
 * inference.cloud.api-key=${ANTHROPIC_API_KEY:}
 * inference.timeouts.startup=30s
 * inference.timeouts.generation=120s
 * </pre>
 *
 * <p>Blank bundled paths resolve against the per-OS application data directory
 * (see {@link AppDataDirectories}).
 */
@Validated
@ConfigurationProperties(prefix = "inference")
public class InferenceProperties {

    @NotNull
    private BackendKind backend = BackendKind.BUNDLED;

    /** Overrides the per-OS data directory (models/, bin/, pid marker). */
    private String dataDir;

    /** Start the bundled server when the application starts. */
    private boolean autostart = false;

    @Valid
    private Bundled bundled = new Bundled();

    @Valid
    private External external = new External();

    @Valid
    private Cloud cloud = new Cloud();

    @Valid
    private Timeouts timeouts = new Timeouts();

    @Valid
    private Generation generation = new Generation();

    public BackendKind getBackend() {
        return backend;
    }

    public void setBackend(BackendKind backend) {
        this.backend = backend;
    }

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public boolean isAutostart() {
        return autostart;
    }

    public void setAutostart(boolean autostart) {
        this.autostart = autostart;
    }

    public Bundled getBundled() {
        return bundled;
    }

    public void setBundled(Bundled bundled) {
        this.bundled = bundled;
    }

    public External getExternal() {
        return external;
    }

    public void setExternal(External external) {
        this.external = external;
    }

    public Cloud getCloud() {
        return cloud;
    }

    public void setCloud(Cloud cloud) {
        this.cloud = cloud;
    }

    public Timeouts getTimeouts() {
        return timeouts;
    }

    public void setTimeouts(Timeouts timeouts) {
        this.timeouts = timeouts;
    }

    public Generation getGeneration() {
        return generation;
    }

    public void setGeneration(Generation generation) {
        this.generation = generation;
    }

    /**
     * Bundled llama.cpp server settings.
     */
    public static class Bundled {
        /** Catalog id of the default model when {@code model-path} is blank. */
        private String modelId = "gemma-2-2b-it-q4";
        private String modelPath;
        private String serverPath;

        @Min(value = 1, message = "Bundled port must be between 1 and 65535")
        @Max(value = 65535, message = "Bundled port must be between 1 and 65535")
        private int port = 18080;

        @Positive(message = "Context size must be positive")
        private int contextSize = 2048;

        @Min(value = 0, message = "GPU layers must not be negative")
        private int gpuLayers = 0;

        public String getModelId() {
            return modelId;
        }

        public void setModelId(String modelId) {
            this.modelId = modelId;
        }

        public String getModelPath() {
            return modelPath;
        }

        public void setModelPath(String modelPath) {
            this.modelPath = modelPath;
        }

        public String getServerPath() {
            return serverPath;
        }

        public void setServerPath(String serverPath) {
            this.serverPath = serverPath;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public int getContextSize() {
            return contextSize;
        }

        public void setContextSize(int contextSize) {
            this.contextSize = contextSize;
        }

        public int getGpuLayers() {
            return gpuLayers;
        }

        public void setGpuLayers(int gpuLayers) {
            this.gpuLayers = gpuLayers;
        }
    }

    /**
     * Externally-running local service (Ollama API).
     */
    public static class External {
        @NotBlank(message = "External host must not be blank")
        private String host = "http://localhost:11434";

        @NotBlank(message = "External model must not be blank")
        private String model = "qwen2.5:7b";

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }
    }

    /**
     * Remote provider settings. A blank model falls back to the provider's default.
     */
    public static class Cloud {
        @NotBlank(message = "Cloud provider must not be blank")
        private String provider = "anthropic";
        private String apiKey = "";
        private String model = "";
        private String endpoint = "";

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }
    }

    /**
     * HTTP and process timeouts.
     */
    public static class Timeouts {
        /** Liveness/status probes. */
        @NotNull
        private Duration probe = Duration.ofSeconds(2);

        /** Generation requests; LLM latency varies with hardware. */
        @NotNull
        private Duration generation = Duration.ofSeconds(120);

        /** Ceiling for the bundled server to report healthy after spawn. */
        @NotNull
        private Duration startup = Duration.ofSeconds(30);

        /** Interval between health polls during startup. */
        @NotNull
        private Duration pollInterval = Duration.ofMillis(500);

        /** Wait after interrupting the managed server before force-killing it. */
        @NotNull
        private Duration gracefulStop = Duration.ofSeconds(5);

        public Duration getProbe() {
            return probe;
        }

        public void setProbe(Duration probe) {
            this.probe = probe;
        }

        public Duration getGeneration() {
            return generation;
        }

        public void setGeneration(Duration generation) {
            this.generation = generation;
        }

        public Duration getStartup() {
            return startup;
        }

        public void setStartup(Duration startup) {
            this.startup = startup;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getGracefulStop() {
            return gracefulStop;
        }

        public void setGracefulStop(Duration gracefulStop) {
            this.gracefulStop = gracefulStop;
        }
    }

    /**
     * Fixed generation parameters sent to completion endpoints.
     */
    public static class Generation {
        @Positive(message = "Max tokens must be positive")
        private int maxTokens = 1024;

        @Min(0)
        @Max(2)
        private double temperature = 0.7;

        private List<String> stop = new ArrayList<>(List.of("\n\n\n"));

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public List<String> getStop() {
            return stop;
        }

        public void setStop(List<String> stop) {
            this.stop = stop;
        }
    }
}
