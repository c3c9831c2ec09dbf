package com.phillippitts.summarizer.service.bundled;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.phillippitts.summarizer.domain.BundledParameters;
import com.phillippitts.summarizer.domain.BundledStatus;
import com.phillippitts.summarizer.domain.GenerationOptions;
import com.phillippitts.summarizer.exception.InferenceException;
import com.phillippitts.summarizer.exception.NotRunningException;
import com.phillippitts.summarizer.exception.PortConflictException;
import com.phillippitts.summarizer.exception.StartupTimeoutException;
import com.phillippitts.summarizer.service.health.HealthProbe;
import com.phillippitts.summarizer.service.http.JsonHttpClient;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongFunction;

import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.serviceUnavailable;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static com.phillippitts.summarizer.service.bundled.BundledTestDoubles.ProcessBehavior;
import static com.phillippitts.summarizer.service.bundled.BundledTestDoubles.StubProcessFactory;
import static com.phillippitts.summarizer.service.bundled.BundledTestDoubles.TestProcess;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.when;

@WireMockTest
class BundledProcessManagerTest {

    private static final LifecycleTimeouts FAST = new LifecycleTimeouts(
            Duration.ofMillis(600), Duration.ofMillis(50), Duration.ofMillis(200), Duration.ofMillis(200));

    @TempDir
    Path dir;

    private Path marker;
    private Path model;
    private Path server;
    private HttpClient client;

    @BeforeEach
    void setUp() throws IOException {
        marker = dir.resolve("llama-server.pid");
        model = Files.writeString(dir.resolve("model.gguf"), "weights");
        server = Files.writeString(dir.resolve("llama-server"), "binary");
        client = HttpClient.newHttpClient();
    }

    private BundledProcessManager manager(int port, ProcessFactory factory, boolean portFree) {
        return manager(port, factory, portFree, pid -> Optional.empty());
    }

    private BundledProcessManager manager(int port, ProcessFactory factory, boolean portFree,
                                          LongFunction<Optional<ProcessHandle>> lookup) {
        BundledParameters params = new BundledParameters(model, server, port, 2048, 0);
        return new BundledProcessManager(params, marker, factory, p -> portFree,
                new HealthProbe(client, Duration.ofMillis(200)), new JsonHttpClient(client), FAST,
                GenerationOptions.defaults(), lookup);
    }

    @Test
    void startSpawnsServerAndWritesMarker(WireMockRuntimeInfo wm) throws IOException {
        stubFor(get(urlEqualTo("/health")).willReturn(okJson("{\"status\":\"ok\"}")));
        TestProcess process = new TestProcess(ProcessBehavior.longRunning(4242));
        StubProcessFactory factory = new StubProcessFactory(process);
        BundledProcessManager mgr = manager(wm.getHttpPort(), factory, true);

        mgr.start();

        assertThat(mgr.getState()).isEqualTo(ProcessState.RUNNING_MANAGED);
        assertThat(Files.readString(marker).trim()).isEqualTo("4242");
        List<String> cmd = factory.commands.get(0);
        assertThat(cmd).containsSequence("-m", model.toAbsolutePath().toString());
        assertThat(cmd).containsSequence("--port", String.valueOf(wm.getHttpPort()));
        assertThat(cmd).containsSequence("-c", "2048");
        assertThat(cmd).doesNotContain("-ngl");
        assertThat(factory.environments.get(0))
                .containsEntry("LD_LIBRARY_PATH", server.toAbsolutePath().getParent().toString());
    }

    @Test
    void secondStartIsNoOp(WireMockRuntimeInfo wm) {
        stubFor(get(urlEqualTo("/health")).willReturn(okJson("{}")));
        StubProcessFactory factory = new StubProcessFactory(new TestProcess(ProcessBehavior.longRunning(7)));
        BundledProcessManager mgr = manager(wm.getHttpPort(), factory, true);

        mgr.start();
        mgr.start();

        assertThat(factory.starts.get()).isEqualTo(1);
        assertThat(mgr.isRunning()).isTrue();
    }

    @Test
    void stopTerminatesOwnedServerAndRemovesMarker(WireMockRuntimeInfo wm) {
        stubFor(get(urlEqualTo("/health")).willReturn(okJson("{}")));
        TestProcess process = new TestProcess(ProcessBehavior.longRunning(11));
        BundledProcessManager mgr = manager(wm.getHttpPort(), new StubProcessFactory(process), true);
        mgr.start();

        mgr.stop();
        mgr.stop();

        assertThat(process.wasDestroyCalled()).isTrue();
        assertThat(process.isAlive()).isFalse();
        assertThat(marker).doesNotExist();
        assertThat(mgr.getState()).isEqualTo(ProcessState.STOPPED);
    }

    @Test
    void stopForceKillsServerIgnoringGracefulSignal(WireMockRuntimeInfo wm) {
        stubFor(get(urlEqualTo("/health")).willReturn(okJson("{}")));
        TestProcess process = new TestProcess(new ProcessBehavior(12, "", 0, -1, true));
        BundledProcessManager mgr = manager(wm.getHttpPort(), new StubProcessFactory(process), true);
        mgr.start();

        mgr.stop();

        assertThat(process.wasDestroyCalled()).isTrue();
        assertThat(process.wasForciblyDestroyed()).isTrue();
        assertThat(marker).doesNotExist();
    }

    @Test
    void closedManagerRefusesToStart(WireMockRuntimeInfo wm) {
        stubFor(get(urlEqualTo("/health")).willReturn(okJson("{}")));
        StubProcessFactory factory = new StubProcessFactory(new TestProcess(ProcessBehavior.longRunning(23)));
        BundledProcessManager mgr = manager(wm.getHttpPort(), factory, true);

        mgr.close();

        assertThatThrownBy(mgr::start)
                .isInstanceOf(InferenceException.class)
                .hasMessageContaining("closed");
        assertThat(factory.starts.get()).isZero();
        assertThat(marker).doesNotExist();
    }

    @Test
    void adoptsHealthyServerOnBusyPortAndNeverSignalsIt(WireMockRuntimeInfo wm) {
        stubFor(get(urlEqualTo("/health")).willReturn(okJson("{}")));
        TestProcess unused = new TestProcess(ProcessBehavior.longRunning(13));
        StubProcessFactory factory = new StubProcessFactory(unused);
        BundledProcessManager mgr = manager(wm.getHttpPort(), factory, false);

        mgr.start();
        assertThat(mgr.getState()).isEqualTo(ProcessState.RUNNING_ADOPTED);

        mgr.stop();

        assertThat(factory.starts.get()).isZero();
        assertThat(unused.wasDestroyCalled()).isFalse();
        assertThat(marker).doesNotExist();
        assertThat(mgr.getState()).isEqualTo(ProcessState.STOPPED);
    }

    @Test
    void busyPortWithoutHealthyServerIsConflict(WireMockRuntimeInfo wm) {
        stubFor(get(urlEqualTo("/health")).willReturn(serviceUnavailable()));
        StubProcessFactory factory = new StubProcessFactory(new TestProcess(ProcessBehavior.longRunning(14)));
        BundledProcessManager mgr = manager(wm.getHttpPort(), factory, false);

        assertThatThrownBy(mgr::start)
                .isInstanceOf(PortConflictException.class)
                .hasMessageContaining(String.valueOf(wm.getHttpPort()));
        assertThat(factory.starts.get()).isZero();
        assertThat(mgr.getState()).isEqualTo(ProcessState.STOPPED);
    }

    @Test
    void startupTimeoutStopsServerAndRemovesMarker(WireMockRuntimeInfo wm) {
        stubFor(get(urlEqualTo("/health")).willReturn(serviceUnavailable()));
        TestProcess process = new TestProcess(ProcessBehavior.longRunning(15));
        BundledProcessManager mgr = manager(wm.getHttpPort(), new StubProcessFactory(process), true);

        long start = System.nanoTime();
        assertThatThrownBy(mgr::start).isInstanceOf(StartupTimeoutException.class);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

        assertThat(elapsedMs).isLessThan(5000);
        assertThat(process.wasDestroyCalled()).isTrue();
        assertThat(marker).doesNotExist();
        assertThat(mgr.isRunning()).isFalse();
    }

    @Test
    void startupTimeoutKeepsMarkerWhenServerSurvivesKill(WireMockRuntimeInfo wm) throws IOException {
        stubFor(get(urlEqualTo("/health")).willReturn(serviceUnavailable()));
        TestProcess process = new TestProcess(new ProcessBehavior(21, "", 0, -1, true)).survivingKill();
        BundledProcessManager mgr = manager(wm.getHttpPort(), new StubProcessFactory(process), true);

        assertThatThrownBy(mgr::start).isInstanceOf(StartupTimeoutException.class);

        assertThat(process.wasForciblyDestroyed()).isTrue();
        assertThat(process.isAlive()).isTrue();
        assertThat(Files.readString(marker).trim()).isEqualTo("21");
        assertThat(mgr.isRunning()).isFalse();
    }

    @Test
    void interruptedStartupForceKillsServerBeforeDroppingMarker(WireMockRuntimeInfo wm) throws Exception {
        stubFor(get(urlEqualTo("/health")).willReturn(serviceUnavailable()));
        TestProcess process = new TestProcess(new ProcessBehavior(22, "", 0, -1, true));
        BundledParameters params = new BundledParameters(model, server, wm.getHttpPort(), 2048, 0);
        LifecycleTimeouts slowStartup = new LifecycleTimeouts(
                Duration.ofSeconds(10), Duration.ofMillis(500), Duration.ofSeconds(5), Duration.ofMillis(200));
        BundledProcessManager mgr = new BundledProcessManager(params, marker, new StubProcessFactory(process),
                p -> true, new HealthProbe(client, Duration.ofMillis(200)), new JsonHttpClient(client),
                slowStartup, GenerationOptions.defaults());

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread starter = new Thread(() -> {
            try {
                mgr.start();
            } catch (RuntimeException e) {
                failure.set(e);
            }
        }, "bundled-start");
        starter.start();
        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(() -> Files.exists(marker));
        starter.interrupt();
        starter.join(5000);

        assertThat(failure.get()).isInstanceOf(InferenceException.class);
        assertThat(process.wasForciblyDestroyed()).isTrue();
        assertThat(process.isAlive()).isFalse();
        assertThat(marker).doesNotExist();
        assertThat(mgr.getState()).isEqualTo(ProcessState.STOPPED);
    }

    @Test
    void earlyExitFailsFastWithExitCodeAndStderr(WireMockRuntimeInfo wm) {
        stubFor(get(urlEqualTo("/health")).willReturn(serviceUnavailable()));
        TestProcess process = new TestProcess(ProcessBehavior.exitsImmediately(1, "error loading model"));
        BundledProcessManager mgr = manager(wm.getHttpPort(), new StubProcessFactory(process), true);

        assertThatThrownBy(mgr::start)
                .isInstanceOf(InferenceException.class)
                .isNotInstanceOf(StartupTimeoutException.class)
                .hasMessageContaining("exited during startup")
                .hasMessageContaining("exitCode=1")
                .hasMessageContaining("error loading model");
        assertThat(marker).doesNotExist();
        assertThat(mgr.getState()).isEqualTo(ProcessState.STOPPED);
    }

    @Test
    void staleMarkerProcessIsTerminatedBeforeSpawning(WireMockRuntimeInfo wm) throws IOException {
        stubFor(get(urlEqualTo("/health")).willReturn(okJson("{}")));
        Files.writeString(marker, "999");
        ProcessHandle stale = mock(ProcessHandle.class);
        when(stale.isAlive()).thenReturn(true);
        when(stale.onExit()).thenReturn(CompletableFuture.completedFuture(stale));
        BundledProcessManager mgr = manager(wm.getHttpPort(),
                new StubProcessFactory(new TestProcess(ProcessBehavior.longRunning(16))), true,
                pid -> pid == 999 ? Optional.of(stale) : Optional.empty());

        mgr.start();

        org.mockito.Mockito.verify(stale).destroy();
        org.mockito.Mockito.verify(stale, never()).destroyForcibly();
        assertThat(Files.readString(marker).trim()).isEqualTo("16");
    }

    @Test
    void staleMarkerForDeadProcessIsDiscarded(WireMockRuntimeInfo wm) throws IOException {
        Files.writeString(marker, "not-a-pid");
        stubFor(get(urlEqualTo("/health")).willReturn(okJson("{}")));
        BundledProcessManager mgr = manager(wm.getHttpPort(), (command, workingDir, env) -> {
            throw new IOException("no binary");
        }, true);

        assertThatThrownBy(mgr::start)
                .isInstanceOf(InferenceException.class)
                .hasMessageContaining("Failed to start llama server");
        assertThat(marker).doesNotExist();
    }

    @Test
    void completeRequiresRunningServer(WireMockRuntimeInfo wm) {
        BundledProcessManager mgr = manager(wm.getHttpPort(),
                new StubProcessFactory(new TestProcess(ProcessBehavior.longRunning(17))), true);

        assertThatThrownBy(() -> mgr.complete("hello")).isInstanceOf(NotRunningException.class);
        assertThatThrownBy(mgr::getModelInfo).isInstanceOf(NotRunningException.class);
    }

    @Test
    void completePostsPromptAndReturnsContent(WireMockRuntimeInfo wm) {
        stubFor(get(urlEqualTo("/health")).willReturn(okJson("{}")));
        stubFor(post(urlEqualTo("/completion")).willReturn(okJson("{\"content\":\"{\\\"summary\\\":\\\"done\\\"}\"}")));
        BundledProcessManager mgr = manager(wm.getHttpPort(),
                new StubProcessFactory(new TestProcess(ProcessBehavior.longRunning(18))), true);
        mgr.start();

        String content = mgr.complete("Summarize this");

        assertThat(content).isEqualTo("{\"summary\":\"done\"}");
        verify(postRequestedFor(urlEqualTo("/completion"))
                .withRequestBody(matchingJsonPath("$.prompt", equalTo("Summarize this")))
                .withRequestBody(matchingJsonPath("$.max_tokens", equalTo("1024")))
                .withRequestBody(matchingJsonPath("$.stop[0]")));
    }

    @Test
    void statusReportsFilesAndStateWithoutSideEffects(WireMockRuntimeInfo wm) throws IOException {
        Files.delete(model);
        StubProcessFactory factory = new StubProcessFactory(new TestProcess(ProcessBehavior.longRunning(19)));
        BundledProcessManager mgr = manager(wm.getHttpPort(), factory, true);

        BundledStatus status = mgr.getStatus();

        assertThat(status.available()).isFalse();
        assertThat(status.modelPresent()).isFalse();
        assertThat(status.executablePresent()).isTrue();
        assertThat(status.running()).isFalse();
        assertThat(status.state()).isEqualTo("STOPPED");
        assertThat(status.port()).isEqualTo(wm.getHttpPort());
        assertThat(factory.starts.get()).isZero();
    }

    @Test
    void gpuLayersAddOffloadFlag(WireMockRuntimeInfo wm) {
        BundledParameters params = new BundledParameters(model, server, wm.getHttpPort(), 4096, 33);
        BundledProcessManager mgr = new BundledProcessManager(params, marker,
                new StubProcessFactory(new TestProcess(ProcessBehavior.longRunning(20))), p -> true,
                new HealthProbe(client, Duration.ofMillis(200)), new JsonHttpClient(client), FAST,
                GenerationOptions.defaults());

        assertThat(mgr.buildCommand()).containsSequence("-c", "4096").containsSequence("-ngl", "33");
    }
}
