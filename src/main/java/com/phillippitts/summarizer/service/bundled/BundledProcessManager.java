package com.phillippitts.summarizer.service.bundled;

import com.phillippitts.summarizer.domain.BundledParameters;
import com.phillippitts.summarizer.domain.BundledStatus;
import com.phillippitts.summarizer.domain.GenerationOptions;
import com.phillippitts.summarizer.exception.InferenceException;
import com.phillippitts.summarizer.exception.InferenceExceptionBuilder;
import com.phillippitts.summarizer.exception.NotRunningException;
import com.phillippitts.summarizer.exception.PortConflictException;
import com.phillippitts.summarizer.exception.StartupTimeoutException;
import com.phillippitts.summarizer.service.health.HealthProbe;
import com.phillippitts.summarizer.service.http.JsonHttpClient;
import com.phillippitts.summarizer.util.ProcessTimeouts;
import com.phillippitts.summarizer.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongFunction;

/**
 * Owns the lifecycle of one local llama.cpp completion server.
 *
 * <p>Responsibilities:
 * - Recover from a previous crash by terminating the PID recorded in the marker file
 * - Adopt an already-healthy server holding the configured port instead of spawning a second one
 * - Spawn {@code server -m <model> --port <port> -c <ctx> [-ngl <layers>]} via {@link ProcessFactory}
 * - Poll {@code /health} until ready or the startup budget runs out
 * - Terminate only processes it spawned; adopted servers are left running on stop
 *
 * <p>Lifecycle transitions are serialised by a {@link ReentrantLock}; {@link #complete(String)}
 * and status reads do not take the lock.
 */
public class BundledProcessManager implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(BundledProcessManager.class);

    static final int STDERR_TAIL_MAX_CHARS = 4096;
    private static final int ERROR_SNIPPET_MAX_CHARS = 1000;
    private static final String BACKEND = "bundled";

    private final BundledParameters params;
    private final PidMarkerFile pidMarker;
    private final ProcessFactory processFactory;
    private final PortProbe portProbe;
    private final HealthProbe healthProbe;
    private final JsonHttpClient http;
    private final LifecycleTimeouts timeouts;
    private final GenerationOptions generation;
    private final LongFunction<Optional<ProcessHandle>> processLookup;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile ProcessState state = ProcessState.STOPPED;
    private volatile ManagedProcess current;
    private volatile StderrTail stderr;
    private volatile boolean closed;

    public BundledProcessManager(BundledParameters params,
                                 Path pidMarkerPath,
                                 ProcessFactory processFactory,
                                 PortProbe portProbe,
                                 HealthProbe healthProbe,
                                 JsonHttpClient http,
                                 LifecycleTimeouts timeouts,
                                 GenerationOptions generation) {
        this(params, pidMarkerPath, processFactory, portProbe, healthProbe, http, timeouts, generation,
                ProcessHandle::of);
    }

    BundledProcessManager(BundledParameters params,
                          Path pidMarkerPath,
                          ProcessFactory processFactory,
                          PortProbe portProbe,
                          HealthProbe healthProbe,
                          JsonHttpClient http,
                          LifecycleTimeouts timeouts,
                          GenerationOptions generation,
                          LongFunction<Optional<ProcessHandle>> processLookup) {
        this.params = Objects.requireNonNull(params, "params");
        this.pidMarker = new PidMarkerFile(Objects.requireNonNull(pidMarkerPath, "pidMarkerPath"));
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.portProbe = Objects.requireNonNull(portProbe, "portProbe");
        this.healthProbe = Objects.requireNonNull(healthProbe, "healthProbe");
        this.http = Objects.requireNonNull(http, "http");
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
        this.generation = Objects.requireNonNull(generation, "generation");
        this.processLookup = Objects.requireNonNull(processLookup, "processLookup");
    }

    /**
     * Brings the server to a running state. No-op when already running.
     *
     * @throws PortConflictException when the port is held by something that is not a healthy server
     * @throws StartupTimeoutException when the spawned server never reports healthy
     * @throws InferenceException when the process cannot be spawned or exits during startup,
     *         or when this manager has been closed
     */
    public void start() {
        lock.lock();
        try {
            if (closed) {
                throw new InferenceException("Bundled server manager is closed", BACKEND);
            }
            if (state.isRunning()) {
                return;
            }
            state = ProcessState.STARTING;
            try {
                terminateStaleProcess();

                if (!portProbe.isFree(params.port())) {
                    if (healthProbe.isHealthy(params.baseUrl())) {
                        current = ManagedProcess.adopted();
                        state = ProcessState.RUNNING_ADOPTED;
                        LOG.info("Adopted healthy server already listening on port {}", params.port());
                        return;
                    }
                    throw new PortConflictException(params.port());
                }

                spawnAndAwaitHealthy();
            } catch (RuntimeException e) {
                ManagedProcess leftover = current;
                if (leftover != null && leftover.managedByUs()) {
                    terminateAndForget(leftover);
                    closeStderr();
                }
                current = null;
                state = ProcessState.STOPPED;
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops a server this manager spawned; forgets an adopted one without signalling it.
     * Idempotent.
     */
    public void stop() {
        lock.lock();
        try {
            ManagedProcess handle = current;
            if (handle == null || state == ProcessState.STOPPED) {
                state = ProcessState.STOPPED;
                current = null;
                return;
            }
            if (!handle.managedByUs()) {
                LOG.info("Releasing adopted server on port {} without stopping it", params.port());
                current = null;
                state = ProcessState.STOPPED;
                return;
            }
            state = ProcessState.STOPPING;
            terminateAndForget(handle);
            closeStderr();
            current = null;
            state = ProcessState.STOPPED;
            LOG.info("Bundled server stopped (pid={})", handle.pid());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sends a completion request to the running server.
     *
     * @return generated text from the {@code content} field
     * @throws NotRunningException when the server is not in a running state
     */
    public String complete(String prompt) {
        if (!state.isRunning()) {
            throw new NotRunningException();
        }
        JSONObject body = new JSONObject()
                .put("prompt", prompt)
                .put("max_tokens", generation.maxTokens())
                .put("temperature", generation.temperature())
                .put("stop", new JSONArray(generation.stopSequences()));

        long start = System.nanoTime();
        JSONObject response = http.postJson(BACKEND, URI.create(params.baseUrl() + "/completion"), body,
                Map.of(), generation.timeout());
        LOG.debug("Bundled completion took {} ms", TimeUtils.elapsedMillis(start));
        return response.optString("content", "");
    }

    /**
     * Raw {@code /props} answer describing the loaded model.
     */
    public String getModelInfo() {
        if (!state.isRunning()) {
            throw new NotRunningException();
        }
        return http.getString(BACKEND, URI.create(params.baseUrl() + "/props"), timeouts.probe());
    }

    /**
     * Snapshot of configuration and runtime state. Performs filesystem existence checks only.
     */
    public BundledStatus getStatus() {
        boolean modelPresent = Files.isRegularFile(params.modelAssetPath());
        boolean executablePresent = Files.isRegularFile(params.serverExecutablePath());
        ProcessState snapshot = state;
        return new BundledStatus(
                modelPresent && executablePresent,
                snapshot.isRunning(),
                modelPresent,
                executablePresent,
                params.modelAssetPath().toString(),
                params.serverExecutablePath().toString(),
                params.port(),
                snapshot.name());
    }

    public boolean isRunning() {
        return state.isRunning();
    }

    public ProcessState getState() {
        return state;
    }

    public BundledParameters getParameters() {
        return params;
    }

    /**
     * Stops the server and rejects any later {@link #start()}.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
            stop();
        } finally {
            lock.unlock();
        }
    }

    private void spawnAndAwaitHealthy() {
        List<String> command = buildCommand();
        Path serverDir = params.serverExecutablePath().toAbsolutePath().getParent();
        Map<String, String> env = serverDir == null
                ? Map.of()
                : Map.of("LD_LIBRARY_PATH", serverDir.toString());

        long startNanos = System.nanoTime();
        Process process;
        try {
            process = processFactory.start(command, serverDir, env);
        } catch (IOException e) {
            throw InferenceExceptionBuilder.create("Failed to start llama server")
                    .backend(BACKEND)
                    .metadata("serverPath", params.serverExecutablePath())
                    .cause(e)
                    .build();
        }

        ManagedProcess handle = ManagedProcess.spawned(process);
        current = handle;
        stderr = StderrTail.start(process.getErrorStream(), "llama-server-err", STDERR_TAIL_MAX_CHARS);
        try {
            pidMarker.write(handle.pid());
        } catch (UncheckedIOException e) {
            terminate(process);
            current = null;
            throw InferenceExceptionBuilder.create("Failed to record server pid")
                    .backend(BACKEND)
                    .metadata("marker", pidMarker.path())
                    .cause(e)
                    .build();
        }
        LOG.info("Spawned llama server pid={} on port {}", handle.pid(), params.port());

        awaitHealthy(handle, startNanos);
        state = ProcessState.RUNNING_MANAGED;
        LOG.info("Bundled server ready in {} ms", TimeUtils.elapsedMillis(startNanos));
    }

    private void awaitHealthy(ManagedProcess handle, long startNanos) {
        long deadline = startNanos + timeouts.startup().toNanos();
        while (true) {
            Process process = handle.process();
            if (!process.isAlive()) {
                throw earlyExit(process, startNanos);
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            Duration probeTimeout = shorter(timeouts.probe(), Duration.ofNanos(remaining));
            if (healthProbe.withTimeout(probeTimeout).isHealthy(params.baseUrl())) {
                return;
            }
            remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            sleep(shorter(timeouts.pollInterval(), Duration.ofNanos(remaining)));
        }

        LOG.warn("llama server did not become healthy within {}s; stopping it", timeouts.startup().toSeconds());
        terminateAndForget(handle);
        closeStderr();
        current = null;
        throw new StartupTimeoutException(timeouts.startup());
    }

    private InferenceException earlyExit(Process process, long startNanos) {
        closeStderr();
        String stderrSnippet = stderr == null ? "" : truncate(stderr.snapshot(), ERROR_SNIPPET_MAX_CHARS);
        pidMarker.delete();
        current = null;
        return InferenceExceptionBuilder.create("llama server exited during startup")
                .backend(BACKEND)
                .exitCode(safeExitValue(process))
                .durationMs(TimeUtils.elapsedMillis(startNanos))
                .metadata("serverPath", params.serverExecutablePath())
                .metadata("modelPath", params.modelAssetPath())
                .metadata("stderr", stderrSnippet)
                .build();
    }

    List<String> buildCommand() {
        List<String> cmd = new ArrayList<>();
        cmd.add(params.serverExecutablePath().toAbsolutePath().toString());
        cmd.add("-m");
        cmd.add(params.modelAssetPath().toAbsolutePath().toString());
        cmd.add("--port");
        cmd.add(String.valueOf(params.port()));
        cmd.add("-c");
        cmd.add(String.valueOf(params.contextWindowSize()));
        if (params.gpuOffloadLayers() > 0) {
            cmd.add("-ngl");
            cmd.add(String.valueOf(params.gpuOffloadLayers()));
        }
        return cmd;
    }

    /**
     * Kills a server left behind by a previous run. The marker is always discarded.
     */
    private void terminateStaleProcess() {
        OptionalLong recorded = pidMarker.read();
        if (recorded.isEmpty()) {
            pidMarker.delete();
            return;
        }
        long pid = recorded.getAsLong();
        Optional<ProcessHandle> stale = processLookup.apply(pid).filter(ProcessHandle::isAlive);
        if (stale.isPresent()) {
            ProcessHandle handle = stale.get();
            LOG.warn("Terminating stale llama server pid={} from a previous run", pid);
            handle.destroy();
            try {
                handle.onExit().get(ProcessTimeouts.STALE_PROCESS_GRACE.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                handle.destroyForcibly();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                handle.destroyForcibly();
            } catch (ExecutionException e) {
                LOG.debug("Waiting for stale pid {} failed: {}", pid, e.toString());
            }
        }
        pidMarker.delete();
    }

    /**
     * Terminates a spawned server. The marker is removed only once the process is confirmed gone,
     * otherwise the next start treats it as stale.
     */
    private void terminateAndForget(ManagedProcess handle) {
        if (terminate(handle.process())) {
            pidMarker.delete();
        } else {
            LOG.warn("Server pid {} did not exit; keeping marker for next start", handle.pid());
        }
    }

    /**
     * @return true when the process is confirmed gone
     */
    private boolean terminate(Process process) {
        if (process == null) {
            return true;
        }
        try {
            process.destroy();
            boolean exited = process.waitFor(timeouts.gracefulStop().toMillis(), TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while stopping llama server; sent forced kill");
        }
        return !process.isAlive();
    }

    private void closeStderr() {
        StderrTail tail = stderr;
        if (tail != null) {
            tail.join(ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT.toMillis());
        }
    }

    private static int safeExitValue(Process process) {
        try {
            return process.exitValue();
        } catch (IllegalThreadStateException e) {
            return -1;
        }
    }

    private static Duration shorter(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(Math.max(1, duration.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InferenceException("Interrupted while waiting for llama server", BACKEND, e);
        }
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(text.length() - max);
    }
}
