package com.phillippitts.summarizer.service.asset;

import com.github.tomakehurst.wiremock.http.Fault;
import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.phillippitts.summarizer.config.inference.AppDataDirectories;
import com.phillippitts.summarizer.domain.AssetAvailability;
import com.phillippitts.summarizer.domain.AssetDescriptor;
import com.phillippitts.summarizer.domain.AssetKind;
import com.phillippitts.summarizer.exception.ConfigurationException;
import com.phillippitts.summarizer.exception.DownloadInProgressException;
import com.phillippitts.summarizer.exception.ExtractionException;
import com.phillippitts.summarizer.exception.HttpStatusException;
import com.phillippitts.summarizer.exception.InsufficientDiskSpaceException;
import com.phillippitts.summarizer.exception.NetworkException;
import com.phillippitts.summarizer.util.HostPlatform;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.notFound;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlMatching;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@WireMockTest
class AssetDownloaderTest {

    private static final HostPlatform LINUX = HostPlatform.of("Linux", "amd64");
    private static final byte[] WEIGHTS = "gguf-weights-".repeat(1000).getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path root;

    private AppDataDirectories dirs;
    private HttpClient client;

    @BeforeEach
    void setUp() {
        dirs = new AppDataDirectories(root, LINUX);
        client = HttpClient.newHttpClient();
    }

    private AssetDescriptor model(WireMockRuntimeInfo wm, String path, long expectedSize) {
        return AssetDescriptor.model("test-model", "Test Model", "for tests", expectedSize,
                wm.getHttpBaseUrl() + path, "test-model.gguf");
    }

    private AssetDownloader downloader(DiskSpaceChecker disk, AssetDescriptor... models) {
        return new AssetDownloader(client, disk, dirs, new AssetCatalog(List.of(models)));
    }

    private static DiskSpaceChecker plenty() {
        return dir -> Long.MAX_VALUE;
    }

    private static List<Path> filesIn(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> s = Files.list(dir)) {
            return s.toList();
        }
    }

    @Test
    void downloadsToFinalNameAndReportsProgress(WireMockRuntimeInfo wm) throws IOException {
        stubFor(get(urlEqualTo("/model.gguf")).willReturn(aResponse().withStatus(200)
                .withHeader("Content-Length", String.valueOf(WEIGHTS.length))
                .withBody(WEIGHTS)));
        AssetDescriptor descriptor = model(wm, "/model.gguf", 1);
        List<long[]> progress = new CopyOnWriteArrayList<>();

        Path result = downloader(plenty(), descriptor)
                .download(descriptor, (soFar, total) -> progress.add(new long[]{soFar, total}));

        assertThat(result).isEqualTo(dirs.modelsDir().resolve("test-model.gguf"));
        assertThat(Files.readAllBytes(result)).isEqualTo(WEIGHTS);
        assertThat(filesIn(dirs.modelsDir())).containsExactly(result);
        assertThat(progress).isNotEmpty();
        long[] last = progress.get(progress.size() - 1);
        assertThat(last[0]).isEqualTo(WEIGHTS.length);
        assertThat(last[1]).isEqualTo(WEIGHTS.length);
    }

    @Test
    void progressTotalFallsBackToExpectedSizeWithoutContentLength(WireMockRuntimeInfo wm) {
        stubFor(get(urlEqualTo("/chunked.gguf")).willReturn(aResponse().withStatus(200)
                .withBody(WEIGHTS).withChunkedDribbleDelay(4, 100)));
        AssetDescriptor descriptor = model(wm, "/chunked.gguf", 777_777);
        List<Long> totals = new CopyOnWriteArrayList<>();

        downloader(plenty(), descriptor).download(descriptor, (soFar, total) -> totals.add(total));

        assertThat(totals).isNotEmpty().containsOnly(777_777L);
    }

    @Test
    void insufficientDiskSpaceFailsBeforeAnyNetworkIo(WireMockRuntimeInfo wm) throws IOException {
        AssetDescriptor descriptor = model(wm, "/model.gguf", 5_000_000);

        assertThatThrownBy(() -> downloader(dir -> 1_000, descriptor).download(descriptor, null))
                .isInstanceOf(InsufficientDiskSpaceException.class)
                .satisfies(e -> {
                    InsufficientDiskSpaceException ex = (InsufficientDiskSpaceException) e;
                    assertThat(ex.getAvailableBytes()).isEqualTo(1_000);
                    assertThat(ex.getRequiredBytes()).isEqualTo(5_000_000);
                });

        verify(0, getRequestedFor(urlMatching(".*")));
        assertThat(filesIn(dirs.modelsDir())).isEmpty();
    }

    @Test
    void nonSuccessStatusLeavesNoFiles(WireMockRuntimeInfo wm) throws IOException {
        stubFor(get(urlEqualTo("/missing.gguf")).willReturn(notFound().withBody("no such file")));
        AssetDescriptor descriptor = model(wm, "/missing.gguf", 1);

        assertThatThrownBy(() -> downloader(plenty(), descriptor).download(descriptor, null))
                .isInstanceOf(HttpStatusException.class)
                .satisfies(e -> assertThat(((HttpStatusException) e).getStatusCode()).isEqualTo(404));

        assertThat(filesIn(dirs.modelsDir())).isEmpty();
    }

    @Test
    void transportFailureLeavesNoFiles(WireMockRuntimeInfo wm) throws IOException {
        stubFor(get(urlEqualTo("/reset.gguf")).willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));
        AssetDescriptor descriptor = model(wm, "/reset.gguf", 1);
        AssetDownloader downloader = downloader(plenty(), descriptor);

        assertThatThrownBy(() -> downloader.download(descriptor, null)).isInstanceOf(NetworkException.class);

        assertThat(filesIn(dirs.modelsDir())).isEmpty();
        assertThat(downloader.isDownloading(descriptor.id())).isFalse();
    }

    @Test
    void secondDownloadOfSameAssetFailsImmediately(WireMockRuntimeInfo wm) {
        stubFor(get(urlEqualTo("/slow.gguf")).willReturn(aResponse().withStatus(200)
                .withBody(WEIGHTS).withFixedDelay(1500)));
        AssetDescriptor descriptor = model(wm, "/slow.gguf", 1);
        AssetDownloader downloader = downloader(plenty(), descriptor);

        CompletableFuture<Path> first = CompletableFuture.supplyAsync(() -> downloader.download(descriptor, null));
        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(() -> downloader.isDownloading(descriptor.id()));

        long start = System.nanoTime();
        assertThatThrownBy(() -> downloader.download(descriptor, null))
                .isInstanceOf(DownloadInProgressException.class);
        assertThat((System.nanoTime() - start) / 1_000_000L).isLessThan(1000);

        assertThat(first.join()).exists();
        assertThat(downloader.isDownloading(descriptor.id())).isFalse();
    }

    @Test
    void serverArchiveExtractsExecutableAndLibrariesOnly(WireMockRuntimeInfo wm) throws IOException {
        byte[] zip = zip("build/bin/llama-server", "build/bin/libllama.so", "build/bin/libggml.so",
                "build/bin/llama-cli", "README.md");
        stubFor(get(urlEqualTo("/server.zip")).willReturn(aResponse().withStatus(200).withBody(zip)));
        AssetDescriptor archive = archive(wm);
        Path bin = dirs.binDir();

        Path executable = downloader(plenty()).downloadServerArchive(archive, bin, null);

        assertThat(executable).isEqualTo(bin.resolve("llama-server"));
        assertThat(Files.isExecutable(executable)).isTrue();
        assertThat(filesIn(bin)).extracting(p -> p.getFileName().toString())
                .containsExactlyInAnyOrder("llama-server", "libllama.so", "libggml.so");
    }

    @Test
    void serverArchiveWithoutExecutableListsCandidatesAndCleansUp(WireMockRuntimeInfo wm) throws IOException {
        byte[] zip = zip("build/bin/llama-cli", "build/bin/libllama.so", "docs/readme.txt");
        stubFor(get(urlEqualTo("/server.zip")).willReturn(aResponse().withStatus(200).withBody(zip)));
        AssetDescriptor archive = archive(wm);
        Path bin = dirs.binDir();

        assertThatThrownBy(() -> downloader(plenty()).downloadServerArchive(archive, bin, null))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("llama-server")
                .satisfies(e -> assertThat(((ExtractionException) e).getCandidates())
                        .containsExactlyInAnyOrder("build/bin/llama-cli", "build/bin/libllama.so"));

        assertThat(filesIn(bin)).isEmpty();
    }

    @Test
    void failedArchiveLeavesExistingInstallUntouched(WireMockRuntimeInfo wm) throws IOException {
        byte[] zip = zip("build/bin/llama-cli", "build/bin/libllama.so", "build/bin/libggml.so");
        stubFor(get(urlEqualTo("/server.zip")).willReturn(aResponse().withStatus(200).withBody(zip)));
        AssetDescriptor archive = archive(wm);
        Path bin = Files.createDirectories(dirs.binDir());
        Files.writeString(bin.resolve("llama-server"), "working server");
        Files.writeString(bin.resolve("libllama.so"), "working llama");
        Files.writeString(bin.resolve("libggml.so"), "working ggml");

        assertThatThrownBy(() -> downloader(plenty()).downloadServerArchive(archive, bin, null))
                .isInstanceOf(ExtractionException.class);

        assertThat(bin.resolve("llama-server")).hasContent("working server");
        assertThat(bin.resolve("libllama.so")).hasContent("working llama");
        assertThat(bin.resolve("libggml.so")).hasContent("working ggml");
        try (Stream<Path> siblings = Files.list(bin.getParent())) {
            assertThat(siblings.map(p -> p.getFileName().toString())).noneMatch(n -> n.contains("-staging-"));
        }
    }

    @Test
    void listModelsReportsActualSizeOfDownloadedFiles(WireMockRuntimeInfo wm) throws IOException {
        AssetDescriptor present = model(wm, "/a.gguf", 9_999);
        AssetDescriptor absent = AssetDescriptor.model("other", "Other", "", 123, wm.getHttpBaseUrl() + "/b.gguf",
                "other.gguf");
        Files.createDirectories(dirs.modelsDir());
        Files.write(dirs.modelsDir().resolve("test-model.gguf"), new byte[42]);

        List<AssetAvailability> models = downloader(plenty(), present, absent).listModels();

        assertThat(models).hasSize(2);
        assertThat(models.get(0).downloaded()).isTrue();
        assertThat(models.get(0).sizeBytes()).isEqualTo(42);
        assertThat(models.get(1).downloaded()).isFalse();
        assertThat(models.get(1).sizeBytes()).isEqualTo(123);
    }

    @Test
    void deleteRemovesModelAndToleratesMissingFile(WireMockRuntimeInfo wm) throws IOException {
        AssetDescriptor descriptor = model(wm, "/a.gguf", 1);
        AssetDownloader downloader = downloader(plenty(), descriptor);
        Files.createDirectories(dirs.modelsDir());
        Path file = Files.write(dirs.modelsDir().resolve("test-model.gguf"), new byte[1]);

        downloader.delete(descriptor);
        downloader.delete(descriptor);

        assertThat(file).doesNotExist();
    }

    @Test
    void modelPathRejectsUnknownId(WireMockRuntimeInfo wm) {
        AssetDescriptor descriptor = model(wm, "/a.gguf", 1);
        AssetDownloader downloader = downloader(plenty(), descriptor);

        assertThat(downloader.modelPath("test-model")).isEqualTo(dirs.modelsDir().resolve("test-model.gguf"));
        assertThatThrownBy(() -> downloader.modelPath("nope"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("unknown model: nope");
    }

    private static AssetDescriptor archive(WireMockRuntimeInfo wm) {
        return new AssetDescriptor("llama-server", "server", "", 1, URI.create(wm.getHttpBaseUrl() + "/server.zip"),
                "llama-server", AssetKind.SERVER_ARCHIVE, List.of("libllama.", "libggml."));
    }

    private static byte[] zip(String... entries) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream out = new ZipOutputStream(bytes)) {
            for (String name : entries) {
                out.putNextEntry(new ZipEntry(name));
                out.write(("content of " + name).getBytes(StandardCharsets.UTF_8));
                out.closeEntry();
            }
        }
        return bytes.toByteArray();
    }
}
