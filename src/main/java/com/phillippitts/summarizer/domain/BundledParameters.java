package com.phillippitts.summarizer.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Identifies one (model, binary, port) triple for the bundled completion server.
 * Any field change requires restarting the managed process; record equality is the change test.
 *
 * @param modelAssetPath GGUF model file passed as {@code -m}
 * @param serverExecutablePath llama-server executable
 * @param port local port, also used for the health probe
 * @param contextWindowSize value for {@code -c}
 * @param gpuOffloadLayers value for {@code -ngl}; 0 means CPU only and the flag is omitted
 */
public record BundledParameters(
        Path modelAssetPath,
        Path serverExecutablePath,
        int port,
        int contextWindowSize,
        int gpuOffloadLayers
) implements BackendSettings {

    public static final int DEFAULT_PORT = 18080;
    public static final int DEFAULT_CONTEXT_SIZE = 2048;

    public BundledParameters {
        Objects.requireNonNull(modelAssetPath, "modelAssetPath");
        Objects.requireNonNull(serverExecutablePath, "serverExecutablePath");
        if (port <= 0) {
            port = DEFAULT_PORT;
        }
        if (contextWindowSize <= 0) {
            contextWindowSize = DEFAULT_CONTEXT_SIZE;
        }
        if (gpuOffloadLayers < 0) {
            gpuOffloadLayers = 0;
        }
    }

    public BundledParameters(Path modelAssetPath, Path serverExecutablePath) {
        this(modelAssetPath, serverExecutablePath, DEFAULT_PORT, DEFAULT_CONTEXT_SIZE, 0);
    }

    @Override
    public BackendKind kind() {
        return BackendKind.BUNDLED;
    }

    /**
     * Base URL of the local server, e.g. {@code http://localhost:18080}.
     */
    public String baseUrl() {
        return "http://localhost:" + port;
    }
}
