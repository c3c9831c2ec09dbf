package com.phillippitts.summarizer.service.asset;

import com.phillippitts.summarizer.config.inference.AppDataDirectories;
import com.phillippitts.summarizer.domain.AssetAvailability;
import com.phillippitts.summarizer.domain.AssetDescriptor;
import com.phillippitts.summarizer.domain.AssetKind;
import com.phillippitts.summarizer.exception.AssetException;
import com.phillippitts.summarizer.exception.HttpStatusException;
import com.phillippitts.summarizer.exception.InsufficientDiskSpaceException;
import com.phillippitts.summarizer.exception.NetworkException;
import com.phillippitts.summarizer.util.HostPlatform;
import com.phillippitts.summarizer.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Streams model weights and the server archive from their source URLs into the data directory.
 *
 * <p>Guarantees:
 * <ul>
 *   <li>Disk space is checked against {@link AssetDescriptor#expectedSizeBytes()} before any network I/O.</li>
 *   <li>Bytes land in {@code <final>.download} and are moved to the final name only after the
 *       body was fully received; a failed download never leaves a file under the final name.</li>
 *   <li>At most one download per asset id runs at a time; a second request fails immediately.</li>
 * </ul>
 */
public class AssetDownloader {

    private static final Logger LOG = LogManager.getLogger(AssetDownloader.class);

    static final String TEMP_SUFFIX = ".download";
    private static final int BUFFER_SIZE = 1024 * 1024;
    private static final int ERROR_BODY_MAX_BYTES = 4096;

    private final HttpClient client;
    private final DiskSpaceChecker diskSpace;
    private final AppDataDirectories directories;
    private final AssetCatalog catalog;
    private final DownloadRegistry registry = new DownloadRegistry();
    private final ServerArchiveExtractor extractor = new ServerArchiveExtractor();

    public AssetDownloader(HttpClient client, DiskSpaceChecker diskSpace,
                           AppDataDirectories directories, AssetCatalog catalog) {
        this.client = Objects.requireNonNull(client, "client");
        this.diskSpace = Objects.requireNonNull(diskSpace, "diskSpace");
        this.directories = Objects.requireNonNull(directories, "directories");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /**
     * Downloads a catalog model into the models directory.
     *
     * @return path of the downloaded model file
     */
    public Path download(AssetDescriptor descriptor, DownloadProgressListener listener) {
        return download(descriptor, directories.modelsDir(), listener);
    }

    /**
     * Downloads a single-file asset into {@code destinationDir}.
     *
     * @return path of the final file
     * @throws InsufficientDiskSpaceException before any network I/O when the store is too small
     * @throws com.phillippitts.summarizer.exception.DownloadInProgressException if the id is in flight
     * @throws NetworkException on transport failure
     * @throws HttpStatusException on a non-2xx answer
     */
    public Path download(AssetDescriptor descriptor, Path destinationDir, DownloadProgressListener listener) {
        Objects.requireNonNull(descriptor, "descriptor");
        DownloadProgressListener progress = listener == null ? DownloadProgressListener.NONE : listener;

        registry.acquire(descriptor.id());
        try {
            prepareDestination(descriptor, destinationDir);
            Path finalPath = destinationDir.resolve(descriptor.localFilename());
            Path tempPath = destinationDir.resolve(descriptor.localFilename() + TEMP_SUFFIX);
            try {
                fetch(descriptor, tempPath, progress);
                Files.move(tempPath, finalPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                deleteQuietly(tempPath);
                throw new AssetException(descriptor.id(), "failed to finalize download", e);
            } catch (RuntimeException e) {
                deleteQuietly(tempPath);
                throw e;
            }
            LOG.info("Downloaded {} to {}", descriptor.id(), finalPath);
            return finalPath;
        } finally {
            registry.release(descriptor.id());
        }
    }

    /**
     * Downloads the server archive for this platform into the bin directory and extracts it.
     */
    public Path downloadServerArchive(DownloadProgressListener listener) {
        return downloadServerArchive(catalog.serverArchive(directories.platform()), directories.binDir(), listener);
    }

    /**
     * Downloads a server zip archive and extracts the executable and its shared libraries
     * into {@code destinationDir}. The temporary archive is always removed.
     *
     * @return path of the extracted executable
     * @throws com.phillippitts.summarizer.exception.ExtractionException when the executable is missing
     */
    public Path downloadServerArchive(AssetDescriptor descriptor, Path destinationDir,
                                      DownloadProgressListener listener) {
        Objects.requireNonNull(descriptor, "descriptor");
        if (descriptor.kind() != AssetKind.SERVER_ARCHIVE) {
            throw new AssetException(descriptor.id(), "not a server archive: " + descriptor.kind());
        }
        DownloadProgressListener progress = listener == null ? DownloadProgressListener.NONE : listener;

        registry.acquire(descriptor.id());
        try {
            prepareDestination(descriptor, destinationDir);
            Path tempArchive = destinationDir.resolve(descriptor.localFilename() + ".zip" + TEMP_SUFFIX);
            try {
                fetch(descriptor, tempArchive, progress);
                extractor.extract(tempArchive, destinationDir, descriptor);
            } finally {
                deleteQuietly(tempArchive);
            }
            return destinationDir.resolve(descriptor.localFilename());
        } finally {
            registry.release(descriptor.id());
        }
    }

    public boolean isDownloading(String assetId) {
        return registry.isInFlight(assetId);
    }

    /**
     * Removes a downloaded model. A missing file is not an error.
     */
    public void delete(AssetDescriptor descriptor) {
        Path path = directories.modelsDir().resolve(descriptor.localFilename());
        try {
            if (Files.deleteIfExists(path)) {
                LOG.info("Deleted model {} at {}", descriptor.id(), path);
            }
        } catch (IOException e) {
            throw new AssetException(descriptor.id(), "failed to delete model", e);
        }
    }

    /**
     * Catalog models with their local state. Downloaded models report their actual size on disk.
     */
    public List<AssetAvailability> listModels() {
        List<AssetAvailability> result = new ArrayList<>();
        for (AssetDescriptor model : catalog.models()) {
            Path path = directories.modelsDir().resolve(model.localFilename());
            boolean downloaded = Files.isRegularFile(path);
            long size = model.expectedSizeBytes();
            if (downloaded) {
                try {
                    size = Files.size(path);
                } catch (IOException e) {
                    LOG.debug("Could not stat {}: {}", path, e.toString());
                }
            }
            result.add(new AssetAvailability(model, downloaded, size, isDownloading(model.id())));
        }
        return result;
    }

    /**
     * Local path of a catalog model, whether or not it has been downloaded.
     *
     * @throws com.phillippitts.summarizer.exception.ConfigurationException for an unknown id
     */
    public Path modelPath(String modelId) {
        return directories.modelsDir().resolve(catalog.requireModel(modelId).localFilename());
    }

    public AssetCatalog catalog() {
        return catalog;
    }

    public HostPlatform platform() {
        return directories.platform();
    }

    private void prepareDestination(AssetDescriptor descriptor, Path destinationDir) {
        long available;
        try {
            Files.createDirectories(destinationDir);
            available = diskSpace.usableBytes(destinationDir);
        } catch (IOException e) {
            throw new AssetException(descriptor.id(), "failed to prepare " + destinationDir, e);
        }
        if (available < descriptor.expectedSizeBytes()) {
            throw new InsufficientDiskSpaceException(descriptor.id(), available, descriptor.expectedSizeBytes());
        }
    }

    private void fetch(AssetDescriptor descriptor, Path tempPath, DownloadProgressListener progress) {
        HttpRequest request = HttpRequest.newBuilder(descriptor.sourceUrl()).GET().build();
        long startNanos = System.nanoTime();
        HttpResponse<InputStream> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new NetworkException(descriptor.sourceUrl().toString(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException(descriptor.sourceUrl().toString(), e);
        }

        try (InputStream body = response.body()) {
            if (response.statusCode() / 100 != 2) {
                String errorBody = new String(body.readNBytes(ERROR_BODY_MAX_BYTES), StandardCharsets.UTF_8);
                throw new HttpStatusException("download of " + descriptor.id(), response.statusCode(), errorBody);
            }
            long contentLength = response.headers().firstValueAsLong("Content-Length").orElse(-1L);
            long total = contentLength > 0 ? contentLength : descriptor.expectedSizeBytes();
            long written = copy(body, tempPath, total, progress);
            LOG.debug("Fetched {} bytes for {} in {} ms", written, descriptor.id(), TimeUtils.elapsedMillis(startNanos));
        } catch (IOException e) {
            throw new NetworkException(descriptor.sourceUrl().toString(), e);
        }
    }

    private static long copy(InputStream body, Path target, long total, DownloadProgressListener progress)
            throws IOException {
        byte[] buffer = new byte[BUFFER_SIZE];
        long written = 0;
        try (OutputStream out = Files.newOutputStream(target)) {
            int n;
            while ((n = body.read(buffer)) != -1) {
                out.write(buffer, 0, n);
                written += n;
                progress.onProgress(written, total);
            }
        }
        return written;
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Failed to remove temporary file {}: {}", path, e.toString());
        }
    }
}
