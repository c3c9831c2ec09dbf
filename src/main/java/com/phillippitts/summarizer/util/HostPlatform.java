package com.phillippitts.summarizer.util;

import java.util.Locale;

/**
 * Normalized host operating system and CPU architecture.
 *
 * @param os one of {@code darwin}, {@code windows}, {@code linux}, or the raw lowercase name
 * @param arch one of {@code amd64}, {@code arm64}, or the raw lowercase name
 */
public record HostPlatform(String os, String arch) {

    public static final String DARWIN = "darwin";
    public static final String WINDOWS = "windows";
    public static final String LINUX = "linux";
    public static final String AMD64 = "amd64";
    public static final String ARM64 = "arm64";

    /**
     * Platform of the running JVM.
     */
    public static HostPlatform current() {
        return of(System.getProperty("os.name", ""), System.getProperty("os.arch", ""));
    }

    /**
     * Normalizes JVM-style names ({@code Mac OS X}, {@code x86_64}, {@code aarch64}).
     */
    public static HostPlatform of(String osName, String osArch) {
        String os = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
        String arch = osArch == null ? "" : osArch.toLowerCase(Locale.ROOT);

        String normalizedOs;
        if (os.contains("mac") || os.contains("darwin")) {
            normalizedOs = DARWIN;
        } else if (os.contains("win")) {
            normalizedOs = WINDOWS;
        } else if (os.contains("linux")) {
            normalizedOs = LINUX;
        } else {
            normalizedOs = os;
        }

        String normalizedArch = switch (arch) {
            case "x86_64", "amd64", "x64" -> AMD64;
            case "aarch64", "arm64" -> ARM64;
            default -> arch;
        };
        return new HostPlatform(normalizedOs, normalizedArch);
    }

    public boolean isWindows() {
        return WINDOWS.equals(os);
    }

    /**
     * File name of the completion server executable on this platform.
     */
    public String serverExecutableName() {
        return isWindows() ? "llama-server.exe" : "llama-server";
    }
}
