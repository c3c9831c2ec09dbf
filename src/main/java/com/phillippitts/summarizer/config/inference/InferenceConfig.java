package com.phillippitts.summarizer.config.inference;

import com.phillippitts.summarizer.domain.BackendSettings;
import com.phillippitts.summarizer.domain.GenerationOptions;
import com.phillippitts.summarizer.service.asset.AssetCatalog;
import com.phillippitts.summarizer.service.asset.AssetDownloader;
import com.phillippitts.summarizer.service.asset.FileStoreDiskSpaceChecker;
import com.phillippitts.summarizer.service.bundled.BundledProcessManager;
import com.phillippitts.summarizer.service.bundled.DefaultProcessFactory;
import com.phillippitts.summarizer.service.bundled.LifecycleTimeouts;
import com.phillippitts.summarizer.service.bundled.PortProbe;
import com.phillippitts.summarizer.service.health.HealthProbe;
import com.phillippitts.summarizer.service.http.JsonHttpClient;
import com.phillippitts.summarizer.service.inference.BackendFactory;
import com.phillippitts.summarizer.service.inference.BundledManagerFactory;
import com.phillippitts.summarizer.service.inference.DefaultBackendFactory;
import com.phillippitts.summarizer.service.inference.InferenceAutostart;
import com.phillippitts.summarizer.service.inference.InferenceService;
import com.phillippitts.summarizer.service.metrics.InferenceMetrics;
import com.phillippitts.summarizer.service.prompt.PromptCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Wires the inference layer from {@link InferenceProperties}.
 */
@Configuration
public class InferenceConfig {

    private static final Logger LOG = LogManager.getLogger(InferenceConfig.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final InferenceProperties properties;

    public InferenceConfig(InferenceProperties properties) {
        this.properties = properties;
    }

    @Bean
    public AppDataDirectories appDataDirectories() {
        AppDataDirectories dirs = AppDataDirectories.resolve(properties.getDataDir());
        LOG.info("Application data directory: {}", dirs.root());
        return dirs;
    }

    /**
     * Shared client. Redirects are followed because model hosts answer with CDN redirects.
     */
    @Bean
    public HttpClient inferenceHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public JsonHttpClient jsonHttpClient(HttpClient inferenceHttpClient) {
        return new JsonHttpClient(inferenceHttpClient);
    }

    @Bean
    public HealthProbe healthProbe(HttpClient inferenceHttpClient) {
        return new HealthProbe(inferenceHttpClient, properties.getTimeouts().getProbe());
    }

    @Bean
    public AssetCatalog assetCatalog() {
        return new AssetCatalog();
    }

    @Bean
    public AssetDownloader assetDownloader(HttpClient inferenceHttpClient, AppDataDirectories dirs,
                                           AssetCatalog catalog) {
        return new AssetDownloader(inferenceHttpClient, new FileStoreDiskSpaceChecker(), dirs, catalog);
    }

    /**
     * Downloads run here so REST callers get an immediate answer. One at a time per asset is enforced
     * by the downloader; the pool only bounds how many different assets download in parallel.
     *
     * <p>MDC propagation: copies the submitting request's ThreadContext to the worker.
     */
    @Bean(name = "assetExecutor")
    public Executor assetExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(8);
        executor.setThreadNamePrefix("asset-download-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);

        executor.setTaskDecorator(runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                }
            };
        });

        executor.initialize();
        return executor;
    }

    @Bean
    public GenerationOptions generationOptions() {
        InferenceProperties.Generation gen = properties.getGeneration();
        return new GenerationOptions(gen.getMaxTokens(), gen.getTemperature(), gen.getStop(),
                properties.getTimeouts().getGeneration());
    }

    @Bean
    public LifecycleTimeouts lifecycleTimeouts() {
        InferenceProperties.Timeouts t = properties.getTimeouts();
        return new LifecycleTimeouts(t.getStartup(), t.getPollInterval(), t.getGracefulStop(), t.getProbe());
    }

    /**
     * Each call yields a fresh manager sharing the crash-recovery marker in the data directory.
     */
    @Bean
    public BundledManagerFactory bundledManagerFactory(AppDataDirectories dirs, HealthProbe healthProbe,
                                                       JsonHttpClient jsonHttpClient,
                                                       LifecycleTimeouts lifecycleTimeouts,
                                                       GenerationOptions generationOptions) {
        DefaultProcessFactory processFactory = new DefaultProcessFactory();
        PortProbe portProbe = PortProbe.socketBind();
        Path marker = dirs.pidMarkerFile();
        return params -> new BundledProcessManager(params, marker, processFactory, portProbe, healthProbe,
                jsonHttpClient, lifecycleTimeouts, generationOptions);
    }

    @Bean
    public BackendFactory backendFactory(BundledManagerFactory bundledManagerFactory, JsonHttpClient jsonHttpClient,
                                         HealthProbe healthProbe, GenerationOptions generationOptions) {
        return new DefaultBackendFactory(bundledManagerFactory, jsonHttpClient, healthProbe, generationOptions);
    }

    @Bean
    public PromptCodec promptCodec() {
        return new PromptCodec();
    }

    @Bean
    public BackendSettingsResolver backendSettingsResolver(AppDataDirectories dirs, AssetDownloader assetDownloader) {
        return new BackendSettingsResolver(dirs, assetDownloader);
    }

    @Bean
    public InferenceService inferenceService(BackendFactory backendFactory, PromptCodec promptCodec,
                                             ApplicationEventPublisher publisher, InferenceMetrics metrics,
                                             BackendSettingsResolver resolver) {
        BackendSettings initial = resolver.resolve(properties);
        return new InferenceService(initial, backendFactory, promptCodec, publisher, metrics);
    }

    @Bean
    public InferenceAutostart inferenceAutostart(InferenceService inferenceService) {
        return new InferenceAutostart(inferenceService, properties.isAutostart());
    }
}
