package com.phillippitts.summarizer.config.inference;

import com.phillippitts.summarizer.util.HostPlatform;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the per-user application data directory and the fixed layout beneath it.
 *
 * <pre>
 * {root}/models/            downloaded model weights
 * {root}/bin/               bundled server executable and shared libraries
 * {root}/llama-server.pid   crash-recovery marker for the managed server
 * </pre>
 */
public final class AppDataDirectories {

    static final String APP_NAME = "traq";
    static final String PID_MARKER = "llama-server.pid";

    private final Path root;
    private final HostPlatform platform;

    public AppDataDirectories(Path root, HostPlatform platform) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.platform = Objects.requireNonNull(platform, "platform");
    }

    /**
     * Directories for the running JVM, honoring an explicit override when non-blank.
     */
    public static AppDataDirectories resolve(String override) {
        HostPlatform platform = HostPlatform.current();
        if (override != null && !override.isBlank()) {
            return new AppDataDirectories(Path.of(override.trim()), platform);
        }
        Path home = Path.of(System.getProperty("user.home", "."));
        return new AppDataDirectories(defaultRoot(platform, System.getenv(), home), platform);
    }

    /**
     * Default root per OS: macOS {@code ~/Library/Application Support/traq}, Windows
     * {@code %LOCALAPPDATA%/traq}, otherwise {@code $XDG_DATA_HOME/traq} or {@code ~/.local/share/traq}.
     */
    static Path defaultRoot(HostPlatform platform, Map<String, String> env, Path home) {
        switch (platform.os()) {
            case HostPlatform.DARWIN:
                return home.resolve("Library").resolve("Application Support").resolve(APP_NAME);
            case HostPlatform.WINDOWS: {
                String localAppData = env.get("LOCALAPPDATA");
                if (localAppData != null && !localAppData.isBlank()) {
                    return Path.of(localAppData).resolve(APP_NAME);
                }
                return home.resolve("AppData").resolve("Local").resolve(APP_NAME);
            }
            default: {
                String xdg = env.get("XDG_DATA_HOME");
                if (xdg != null && !xdg.isBlank()) {
                    return Path.of(xdg).resolve(APP_NAME);
                }
                return home.resolve(".local").resolve("share").resolve(APP_NAME);
            }
        }
    }

    public Path root() {
        return root;
    }

    public Path modelsDir() {
        return root.resolve("models");
    }

    public Path binDir() {
        return root.resolve("bin");
    }

    public Path serverExecutable() {
        return binDir().resolve(platform.serverExecutableName());
    }

    public Path pidMarkerFile() {
        return root.resolve(PID_MARKER);
    }

    public HostPlatform platform() {
        return platform;
    }

    @Override
    public String toString() {
        return "AppDataDirectories[root=" + root + "]";
    }
}
