package com.phillippitts.summarizer.config.inference;

import com.phillippitts.summarizer.domain.BackendSettings;
import com.phillippitts.summarizer.domain.BundledParameters;
import com.phillippitts.summarizer.domain.ExternalLocalParameters;
import com.phillippitts.summarizer.domain.RemoteCloudParameters;
import com.phillippitts.summarizer.service.asset.AssetDownloader;

import java.nio.file.Path;

/**
 * Maps {@link InferenceProperties} to the settings variant of the selected backend.
 *
 * <p>Blank bundled paths resolve to the per-OS data directory: the model by catalog id under
 * {@code models/}, the server executable under {@code bin/}.
 */
public class BackendSettingsResolver {

    private final AppDataDirectories directories;
    private final AssetDownloader downloader;

    public BackendSettingsResolver(AppDataDirectories directories, AssetDownloader downloader) {
        this.directories = directories;
        this.downloader = downloader;
    }

    /**
     * @throws com.phillippitts.summarizer.exception.ConfigurationException when a blank model path
     *         meets an unknown catalog model id
     */
    public BackendSettings resolve(InferenceProperties props) {
        return switch (props.getBackend()) {
            case BUNDLED -> {
                InferenceProperties.Bundled b = props.getBundled();
                Path model = isBlank(b.getModelPath())
                        ? downloader.modelPath(b.getModelId())
                        : Path.of(b.getModelPath());
                Path server = isBlank(b.getServerPath())
                        ? directories.serverExecutable()
                        : Path.of(b.getServerPath());
                yield new BundledParameters(model, server, b.getPort(), b.getContextSize(), b.getGpuLayers());
            }
            case EXTERNAL_LOCAL -> new ExternalLocalParameters(props.getExternal().getHost(),
                    props.getExternal().getModel());
            case REMOTE_CLOUD -> {
                InferenceProperties.Cloud c = props.getCloud();
                yield new RemoteCloudParameters(c.getProvider(), c.getApiKey(), c.getModel(), c.getEndpoint());
            }
        };
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
