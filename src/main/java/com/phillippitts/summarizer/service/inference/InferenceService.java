package com.phillippitts.summarizer.service.inference;

import com.phillippitts.summarizer.domain.BackendKind;
import com.phillippitts.summarizer.domain.BackendSettings;
import com.phillippitts.summarizer.domain.BundledStatus;
import com.phillippitts.summarizer.domain.InferenceStatus;
import com.phillippitts.summarizer.domain.RemoteCloudParameters;
import com.phillippitts.summarizer.domain.SessionContext;
import com.phillippitts.summarizer.domain.SetupStatus;
import com.phillippitts.summarizer.domain.SummaryResult;
import com.phillippitts.summarizer.exception.ConfigurationException;
import com.phillippitts.summarizer.exception.HttpStatusException;
import com.phillippitts.summarizer.exception.InferenceExceptionBuilder;
import com.phillippitts.summarizer.exception.NetworkException;
import com.phillippitts.summarizer.exception.NotRunningException;
import com.phillippitts.summarizer.exception.PortConflictException;
import com.phillippitts.summarizer.exception.StartupTimeoutException;
import com.phillippitts.summarizer.exception.SummarizerException;
import com.phillippitts.summarizer.service.backend.BundledBackend;
import com.phillippitts.summarizer.service.backend.InferenceBackend;
import com.phillippitts.summarizer.service.bundled.BundledProcessManager;
import com.phillippitts.summarizer.service.metrics.InferenceMetrics;
import com.phillippitts.summarizer.service.prompt.PromptCodec;
import com.phillippitts.summarizer.util.LogSanitizer;
import com.phillippitts.summarizer.util.TimeUtils;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.net.http.HttpTimeoutException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Orchestrates summary generation across the bundled, external-local and remote-cloud backends.
 *
 * <p>Data flow:
 * <pre>
 * SessionContext → PromptCodec.buildPrompt → active backend → PromptCodec.parseResponse → SummaryResult
 * </pre>
 *
 * <p>Exactly one backend is active. {@link #updateConfig(BackendSettings)} hot-swaps it and owns the
 * stop/recreate/restart decisions for the bundled process. Swaps and shutdown hold the write lock;
 * anything that may start the bundled server holds the read lock, so a replaced manager never
 * spawns a process after it has been closed.
 */
public class InferenceService {

    private static final Logger LOG = LogManager.getLogger(InferenceService.class);
    private static final int PROMPT_LOG_PREVIEW_CHARS = 120;

    private final BackendFactory backendFactory;
    private final PromptCodec codec;
    private final ApplicationEventPublisher publisher;
    private final InferenceMetrics metrics;

    private final ReentrantReadWriteLock configLock = new ReentrantReadWriteLock();
    private volatile BackendSettings settings;
    private volatile InferenceBackend backend;
    private volatile String restartFailure;

    public InferenceService(BackendSettings initialSettings,
                            BackendFactory backendFactory,
                            PromptCodec codec,
                            ApplicationEventPublisher publisher,
                            InferenceMetrics metrics) {
        this.settings = Objects.requireNonNull(initialSettings, "initialSettings");
        this.backendFactory = Objects.requireNonNull(backendFactory, "backendFactory");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.backend = backendFactory.create(initialSettings);
        LOG.info("Inference backend: {}", initialSettings.kind().id());
    }

    /**
     * Generates a summary with the active backend. The bundled server is started on demand.
     *
     * <p>{@code inferenceMs} on the result covers the backend call only, not prompt building,
     * parsing or a bundled auto-start.
     *
     * @throws SummarizerException subtypes describing why generation failed
     */
    public SummaryResult generateSummary(SessionContext context) {
        Objects.requireNonNull(context, "context");
        String prompt = codec.buildPrompt(context);
        LOG.debug("Prompt built: {} chars, preview='{}'", prompt.length(),
                LogSanitizer.truncate(prompt, PROMPT_LOG_PREVIEW_CHARS));

        InferenceBackend active;
        configLock.readLock().lock();
        try {
            active = this.backend;
            if (active instanceof BundledBackend bundled && !bundled.manager().isRunning()) {
                try {
                    bundled.manager().start();
                } catch (RuntimeException e) {
                    throw onFailure(active.kind().id(), e, 0L);
                }
            }
        } finally {
            configLock.readLock().unlock();
        }
        String backendId = active.kind().id();

        long startNanos = System.nanoTime();
        String raw;
        try {
            raw = active.complete(prompt);
        } catch (RuntimeException e) {
            throw onFailure(backendId, e, startNanos);
        }
        long elapsedNanos = System.nanoTime() - startNanos;

        metrics.recordLatency(backendId, elapsedNanos);
        metrics.incrementSuccess(backendId);

        SummaryResult result = codec.parseResponse(raw)
                .withInference(active.modelIdentifier(), TimeUtils.nanosToMillis(elapsedNanos));
        LOG.info("Summary generated by {} ({}) in {} ms", backendId, result.modelUsed(), result.inferenceMs());
        return result;
    }

    /**
     * Applies a new backend configuration.
     *
     * <p>Rules:
     * <ul>
     *   <li>Identical settings are a no-op.</li>
     *   <li>Leaving the bundled backend, or changing any bundled parameter, stops the old manager.</li>
     *   <li>A new bundled manager is started immediately only if the old one was running.
     *       A failed restart is logged and reported by {@link #getSetupStatus()}, not thrown.</li>
     *   <li>Changes between non-bundled settings never touch a process manager.</li>
     * </ul>
     */
    public void updateConfig(BackendSettings newSettings) {
        Objects.requireNonNull(newSettings, "newSettings");
        configLock.writeLock().lock();
        try {
            if (newSettings.equals(settings)) {
                LOG.debug("Inference configuration unchanged");
                return;
            }
            InferenceBackend previous = this.backend;
            boolean bundledWasRunning = false;
            if (previous instanceof BundledBackend bundled) {
                bundledWasRunning = bundled.manager().isRunning();
                bundled.close();
            }

            InferenceBackend next = backendFactory.create(newSettings);
            this.backend = next;
            this.settings = newSettings;
            this.restartFailure = null;
            LOG.info("Inference configuration updated: {} -> {}", previous.kind().id(), newSettings.kind().id());
            LOG.debug("Active inference settings: {}", newSettings);

            if (bundledWasRunning && next instanceof BundledBackend bundled) {
                try {
                    bundled.manager().start();
                } catch (SummarizerException e) {
                    restartFailure = e.getMessage();
                    LOG.warn("Bundled server failed to restart after configuration change: {}", e.getMessage());
                }
            }
        } finally {
            configLock.writeLock().unlock();
        }
    }

    /**
     * Actionable readiness diagnostic for the active backend. Never changes backend state.
     */
    public SetupStatus getSetupStatus() {
        InferenceBackend active = this.backend;
        SetupStatus status = active.setupStatus();
        String failure = restartFailure;
        if (status.ready() && failure != null && active.kind() == BackendKind.BUNDLED) {
            return SetupStatus.notReady(BackendKind.BUNDLED, "Bundled server failed to restart: " + failure,
                    "Check the bundled AI settings in Settings > AI");
        }
        return status;
    }

    public InferenceStatus getStatus() {
        InferenceBackend active = this.backend;
        BackendSettings current = this.settings;
        boolean available = active.isAvailable();
        String model = active.modelIdentifier();
        return switch (active.kind()) {
            case BUNDLED -> {
                BundledProcessManager manager = ((BundledBackend) active).manager();
                String fileName = String.valueOf(manager.getParameters().modelAssetPath().getFileName());
                yield new InferenceStatus(BackendKind.BUNDLED.id(), available, fileName,
                        manager.isRunning(), available, false, false);
            }
            case EXTERNAL_LOCAL -> new InferenceStatus(BackendKind.EXTERNAL_LOCAL.id(), available, model,
                    false, false, available, false);
            case REMOTE_CLOUD -> new InferenceStatus(BackendKind.REMOTE_CLOUD.id(), available, model,
                    false, false, false, ((RemoteCloudParameters) current).hasApiKey());
        };
    }

    /**
     * @throws ConfigurationException when the active backend is not the bundled one
     */
    public void startBundled() {
        configLock.readLock().lock();
        try {
            bundledManager().start();
        } finally {
            configLock.readLock().unlock();
        }
    }

    public void stopBundled() {
        if (backend instanceof BundledBackend bundled) {
            bundled.manager().stop();
        }
    }

    public BundledStatus getBundledStatus() {
        if (backend instanceof BundledBackend bundled) {
            return bundled.manager().getStatus();
        }
        return BundledStatus.notConfigured();
    }

    public BackendSettings currentSettings() {
        return settings;
    }

    /**
     * Stops a bundled server this service started. Adopted servers keep running.
     */
    @PreDestroy
    public void shutdown() {
        configLock.writeLock().lock();
        try {
            backend.close();
        } catch (RuntimeException e) {
            LOG.warn("Error while shutting down inference backend: {}", e.toString());
        } finally {
            configLock.writeLock().unlock();
        }
    }

    private BundledProcessManager bundledManager() {
        if (backend instanceof BundledBackend bundled) {
            return bundled.manager();
        }
        throw new ConfigurationException("inference.backend", "bundled engine not configured");
    }

    /**
     * Records the failure and returns the exception to throw; unexpected runtime errors are wrapped.
     */
    private SummarizerException onFailure(String backendId, RuntimeException e, long startNanos) {
        String reason = failureReason(e);
        metrics.incrementFailure(backendId, reason);
        Map<String, String> context = startNanos == 0L
                ? Map.of("phase", "startup")
                : Map.of("phase", "generation", "elapsedMs", String.valueOf(TimeUtils.elapsedMillis(startNanos)));
        publisher.publishEvent(new InferenceFailureEvent(backendId, null, reason, e.getMessage(), e, context));
        if (e instanceof SummarizerException known) {
            return known;
        }
        return InferenceExceptionBuilder.create("Inference failed")
                .backend(backendId)
                .cause(e)
                .build();
    }

    static String failureReason(Throwable e) {
        if (e instanceof StartupTimeoutException) {
            return "timeout";
        }
        if (e instanceof NetworkException) {
            return e.getCause() instanceof HttpTimeoutException ? "timeout" : "network";
        }
        if (e instanceof HttpStatusException) {
            return "status";
        }
        if (e instanceof ConfigurationException) {
            return "configuration";
        }
        if (e instanceof PortConflictException) {
            return "port_conflict";
        }
        if (e instanceof NotRunningException) {
            return "not_running";
        }
        return "error";
    }
}
