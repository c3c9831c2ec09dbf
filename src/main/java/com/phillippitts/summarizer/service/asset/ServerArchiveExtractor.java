package com.phillippitts.summarizer.service.asset;

import com.phillippitts.summarizer.domain.AssetDescriptor;
import com.phillippitts.summarizer.exception.ExtractionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Enumeration;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Pulls the server executable and its shared libraries out of a release zip.
 *
 * <p>Entries are written flat under their base filename; directory structure inside the archive
 * is ignored. Only the executable named by {@link AssetDescriptor#localFilename()} and files
 * starting with one of the descriptor's shared-library prefixes are kept.
 *
 * <p>Extraction goes to a staging directory next to the destination. Files are moved into the
 * destination only once the executable has been found, so a bad archive never touches an
 * existing install.
 */
class ServerArchiveExtractor {

    private static final Logger LOG = LogManager.getLogger(ServerArchiveExtractor.class);

    List<Path> extract(Path archive, Path destinationDir, AssetDescriptor descriptor) {
        String target = descriptor.localFilename();
        Path staging;
        try {
            Files.createDirectories(destinationDir);
            Path parent = destinationDir.toAbsolutePath().getParent();
            staging = Files.createTempDirectory(parent, destinationDir.getFileName() + "-staging-");
        } catch (IOException e) {
            throw new ExtractionException(descriptor.id(), "failed to prepare " + destinationDir, e);
        }

        try {
            List<String> candidates = new ArrayList<>();
            List<Path> staged = unpack(archive, staging, descriptor, candidates);
            if (!staged.contains(staging.resolve(target))) {
                throw new ExtractionException(descriptor.id(), target, candidates);
            }
            List<Path> installed = new ArrayList<>();
            for (Path file : staged) {
                Path out = destinationDir.resolve(file.getFileName().toString());
                Files.move(file, out, StandardCopyOption.REPLACE_EXISTING);
                installed.add(out);
            }
            LOG.info("Extracted {} file(s) from {} into {}", installed.size(), archive.getFileName(), destinationDir);
            return List.copyOf(installed);
        } catch (IOException e) {
            throw new ExtractionException(descriptor.id(), "failed to extract " + archive.getFileName(), e);
        } finally {
            deleteTree(staging);
        }
    }

    private static List<Path> unpack(Path archive, Path staging, AssetDescriptor descriptor,
                                     List<String> candidates) throws IOException {
        String target = descriptor.localFilename();
        List<Path> staged = new ArrayList<>();
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (entry.isDirectory()) {
                    continue;
                }
                if (entry.getName().contains("llama")) {
                    candidates.add(entry.getName());
                }
                String filename = baseName(entry.getName());
                if (filename.isEmpty() || !isNeeded(filename, target, descriptor.sharedLibraryPrefixes())) {
                    continue;
                }
                Path out = staging.resolve(filename);
                try (InputStream in = zip.getInputStream(entry)) {
                    Files.copy(in, out, StandardCopyOption.REPLACE_EXISTING);
                }
                if (!staged.contains(out)) {
                    staged.add(out);
                }
                if (filename.equals(target)) {
                    markExecutable(out);
                }
            }
        }
        return staged;
    }

    static boolean isNeeded(String filename, String target, List<String> prefixes) {
        if (filename.equals(target)) {
            return true;
        }
        for (String prefix : prefixes) {
            if (filename.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    static String baseName(String entryName) {
        int slash = Math.max(entryName.lastIndexOf('/'), entryName.lastIndexOf('\\'));
        return slash >= 0 ? entryName.substring(slash + 1) : entryName;
    }

    private static void markExecutable(Path file) {
        if (!file.toFile().setExecutable(true, false)) {
            LOG.warn("Could not mark {} executable", file);
        }
    }

    private static void deleteTree(Path dir) {
        try (Stream<Path> files = Files.walk(dir)) {
            files.sorted(Comparator.reverseOrder()).forEach(file -> {
                try {
                    Files.deleteIfExists(file);
                } catch (IOException e) {
                    LOG.warn("Failed to remove staged file {}: {}", file, e.toString());
                }
            });
        } catch (IOException e) {
            LOG.warn("Failed to clean staging directory {}: {}", dir, e.toString());
        }
    }
}
