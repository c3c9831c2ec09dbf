package com.phillippitts.summarizer.service.asset;

import com.phillippitts.summarizer.domain.AssetDescriptor;
import com.phillippitts.summarizer.exception.DownloadInProgressException;
import com.phillippitts.summarizer.exception.SummarizerException;
import com.phillippitts.summarizer.service.metrics.InferenceMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs downloads in the background and keeps their latest progress for polling.
 *
 * <p>A second request for an asset that is still running fails immediately with
 * {@link DownloadInProgressException}; the downloader enforces the same rule underneath.
 */
@Component
public class AssetDownloadCoordinator {

    private static final Logger LOG = LogManager.getLogger(AssetDownloadCoordinator.class);

    private final AssetDownloader downloader;
    private final Executor executor;
    private final InferenceMetrics metrics;
    private final Map<String, DownloadProgress> progress = new ConcurrentHashMap<>();

    public AssetDownloadCoordinator(AssetDownloader downloader,
                                    @Qualifier("assetExecutor") Executor executor,
                                    InferenceMetrics metrics) {
        this.downloader = downloader;
        this.executor = executor;
        this.metrics = metrics;
    }

    /**
     * Queues a catalog model download.
     *
     * @throws com.phillippitts.summarizer.exception.ConfigurationException for an unknown model id
     */
    public DownloadProgress downloadModel(String modelId) {
        AssetDescriptor descriptor = downloader.catalog().requireModel(modelId);
        return submit(descriptor, () -> downloader.download(descriptor, listenerFor(descriptor.id())));
    }

    /**
     * Queues the server archive download for this platform.
     */
    public DownloadProgress downloadServer() {
        AssetDescriptor descriptor = downloader.catalog().serverArchive(downloader.platform());
        return submit(descriptor, () -> downloader.downloadServerArchive(listenerFor(descriptor.id())));
    }

    public Optional<DownloadProgress> progress(String assetId) {
        return Optional.ofNullable(progress.get(assetId));
    }

    private DownloadProgress submit(AssetDescriptor descriptor, Runnable work) {
        String id = descriptor.id();
        DownloadProgress initial = DownloadProgress.started(id, descriptor.expectedSizeBytes());
        DownloadProgress previous = progress.compute(id, (key, current) ->
                current != null && current.state() == DownloadProgress.State.RUNNING ? current : initial);
        if (previous != initial) {
            throw new DownloadInProgressException(id);
        }
        try {
            executor.execute(() -> run(id, work));
        } catch (RejectedExecutionException e) {
            progress.put(id, initial.failed("download queue is full"));
            throw new SummarizerException("Download queue is full, retry later", e);
        }
        LOG.info("Queued download of {}", id);
        return initial;
    }

    private void run(String id, Runnable work) {
        try {
            work.run();
            progress.computeIfPresent(id, (key, current) -> current.completed());
            metrics.recordDownload(id, "success");
        } catch (RuntimeException e) {
            progress.computeIfPresent(id, (key, current) -> current.failed(e.getMessage()));
            metrics.recordDownload(id, e.getClass().getSimpleName());
            LOG.warn("Download of {} failed: {}", id, e.getMessage());
        }
    }

    private DownloadProgressListener listenerFor(String id) {
        return (bytesSoFar, totalBytes) ->
                progress.computeIfPresent(id, (key, current) -> current.advance(bytesSoFar, totalBytes));
    }
}
