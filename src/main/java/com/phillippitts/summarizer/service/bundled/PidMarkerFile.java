package com.phillippitts.summarizer.service.bundled;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Crash-recovery marker holding the PID of the last server this application spawned.
 *
 * <p>Written before a start is declared successful and removed after a confirmed stop,
 * so a marker found at startup means the previous run exited without stopping its server.
 */
final class PidMarkerFile {

    private static final Logger LOG = LogManager.getLogger(PidMarkerFile.class);

    private final Path path;

    PidMarkerFile(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    Path path() {
        return path;
    }

    /**
     * @return the recorded PID, or empty when the marker is absent or unreadable
     */
    OptionalLong read() {
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8).trim();
            return OptionalLong.of(Long.parseLong(content));
        } catch (NoSuchFileException e) {
            return OptionalLong.empty();
        } catch (IOException | NumberFormatException e) {
            LOG.warn("Ignoring unreadable pid marker {}: {}", path, e.toString());
            return OptionalLong.empty();
        }
    }

    void write(long pid) {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, Long.toString(pid), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write pid marker " + path, e);
        }
    }

    void delete() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Failed to remove pid marker {}: {}", path, e.toString());
        }
    }

    boolean exists() {
        return Files.exists(path);
    }
}
