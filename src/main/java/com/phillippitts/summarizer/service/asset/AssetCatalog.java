package com.phillippitts.summarizer.service.asset;

import com.phillippitts.summarizer.domain.AssetDescriptor;
import com.phillippitts.summarizer.domain.AssetKind;
import com.phillippitts.summarizer.exception.ConfigurationException;
import com.phillippitts.summarizer.util.HostPlatform;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Static catalog of downloadable assets: quantized GGUF models for the bundled engine and
 * the per-platform llama.cpp server archive.
 */
public final class AssetCatalog {

    /** llama.cpp release the server archive is pinned to. */
    public static final String SERVER_VERSION = "b4547";
    public static final String SERVER_ASSET_ID = "llama-server";

    private static final String RELEASE_BASE_URL =
            "https://github.com/ggerganov/llama.cpp/releases/download/" + SERVER_VERSION;
    private static final List<String> SHARED_LIBRARY_PREFIXES = List.of("libllama.", "libggml.");

    private static final List<AssetDescriptor> MODELS = List.of(
            AssetDescriptor.model(
                    "gemma-2-2b-it-q4",
                    "Gemma 2 2B (Q4)",
                    "Google's Gemma 2 2B instruction-tuned, quantized to Q4_K_M. Fast and efficient.",
                    1_500_000_000L,
                    "https://huggingface.co/google/gemma-2-2b-it-GGUF/resolve/main/gemma-2-2b-it-q4_k_m.gguf",
                    "gemma-2-2b-it-q4_k_m.gguf"),
            AssetDescriptor.model(
                    "gemma-2-9b-it-q4",
                    "Gemma 2 9B (Q4)",
                    "Google's Gemma 2 9B instruction-tuned, quantized to Q4_K_M. Better quality, slower.",
                    5_400_000_000L,
                    "https://huggingface.co/google/gemma-2-9b-it-GGUF/resolve/main/gemma-2-9b-it-q4_k_m.gguf",
                    "gemma-2-9b-it-q4_k_m.gguf"),
            AssetDescriptor.model(
                    "phi-3-mini-4k-q4",
                    "Phi 3 Mini (Q4)",
                    "Microsoft's Phi 3 Mini 4K context, quantized to Q4_K_M. Very compact.",
                    2_200_000_000L,
                    "https://huggingface.co/microsoft/Phi-3-mini-4k-instruct-gguf/resolve/main/"
                            + "Phi-3-mini-4k-instruct-q4.gguf",
                    "Phi-3-mini-4k-instruct-q4.gguf"),
            AssetDescriptor.model(
                    "qwen2.5-1.5b-q4",
                    "Qwen 2.5 1.5B (Q4)",
                    "Alibaba's Qwen 2.5 1.5B, quantized to Q4_K_M. Very fast, good for simple summaries.",
                    1_100_000_000L,
                    "https://huggingface.co/Qwen/Qwen2.5-1.5B-Instruct-GGUF/resolve/main/"
                            + "qwen2.5-1.5b-instruct-q4_k_m.gguf",
                    "qwen2.5-1.5b-instruct-q4_k_m.gguf")
    );

    private final List<AssetDescriptor> models;

    public AssetCatalog() {
        this(MODELS);
    }

    AssetCatalog(List<AssetDescriptor> models) {
        this.models = List.copyOf(models);
    }

    public List<AssetDescriptor> models() {
        return models;
    }

    public Optional<AssetDescriptor> findModel(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return models.stream().filter(m -> m.id().equals(id)).findFirst();
    }

    /**
     * @throws ConfigurationException when the id is not in the catalog
     */
    public AssetDescriptor requireModel(String id) {
        return findModel(id).orElseThrow(() ->
                new ConfigurationException("inference.bundled.model-id", "unknown model: " + id));
    }

    /**
     * Server archive for the given platform.
     *
     * @throws ConfigurationException when no release archive exists for the platform
     */
    public AssetDescriptor serverArchive(HostPlatform platform) {
        String archiveSuffix;
        long expectedSize;
        switch (platform.os()) {
            case HostPlatform.LINUX:
                if (HostPlatform.AMD64.equals(platform.arch())) {
                    archiveSuffix = "ubuntu-x64";
                } else if (HostPlatform.ARM64.equals(platform.arch())) {
                    archiveSuffix = "ubuntu-arm64";
                } else {
                    throw new ConfigurationException("os.arch",
                            "unsupported Linux architecture: " + platform.arch());
                }
                expectedSize = 50_000_000L;
                break;
            case HostPlatform.DARWIN:
                archiveSuffix = HostPlatform.AMD64.equals(platform.arch()) ? "macos-x64" : "macos-arm64";
                expectedSize = 30_000_000L;
                break;
            case HostPlatform.WINDOWS:
                archiveSuffix = "win-" + (HostPlatform.AMD64.equals(platform.arch()) ? "x64" : platform.arch());
                expectedSize = 60_000_000L;
                break;
            default:
                throw new ConfigurationException("os.name", "unsupported platform: " + platform.os());
        }
        URI url = URI.create(RELEASE_BASE_URL + "/llama-" + SERVER_VERSION + "-bin-" + archiveSuffix + ".zip");
        return new AssetDescriptor(
                SERVER_ASSET_ID,
                "llama.cpp server " + SERVER_VERSION,
                "Local completion server for the bundled engine",
                expectedSize,
                url,
                platform.serverExecutableName(),
                AssetKind.SERVER_ARCHIVE,
                SHARED_LIBRARY_PREFIXES);
    }
}
