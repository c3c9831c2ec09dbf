package com.phillippitts.summarizer.service.backend;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.phillippitts.summarizer.domain.GenerationOptions;
import com.phillippitts.summarizer.domain.RemoteCloudParameters;
import com.phillippitts.summarizer.domain.SetupStatus;
import com.phillippitts.summarizer.exception.BackendException;
import com.phillippitts.summarizer.exception.ConfigurationException;
import com.phillippitts.summarizer.service.http.JsonHttpClient;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@WireMockTest
class RemoteCloudBackendTest {

    private final JsonHttpClient http = new JsonHttpClient(HttpClient.newHttpClient());

    private RemoteCloudBackend backend(String provider, String key, String model, String endpoint) {
        return new RemoteCloudBackend(new RemoteCloudParameters(provider, key, model, endpoint), http,
                GenerationOptions.defaults());
    }

    @Test
    void anthropicSendsVersionHeaderAndReadsFirstContentBlock(WireMockRuntimeInfo wm) {
        stubFor(post(urlEqualTo("/v1/messages"))
                .willReturn(okJson("{\"content\":[{\"type\":\"text\",\"text\":\"{\\\"summary\\\":\\\"ok\\\"}\"}]}")));

        String text = backend("anthropic", "sk-ant-test", "", wm.getHttpBaseUrl() + "/v1/messages")
                .complete("Summarize");

        assertThat(text).isEqualTo("{\"summary\":\"ok\"}");
        verify(postRequestedFor(urlEqualTo("/v1/messages"))
                .withHeader("x-api-key", equalTo("sk-ant-test"))
                .withHeader("anthropic-version", equalTo("2023-06-01"))
                .withRequestBody(matchingJsonPath("$.model", equalTo("claude-3-5-haiku-latest")))
                .withRequestBody(matchingJsonPath("$.max_tokens", equalTo("1024")))
                .withRequestBody(matchingJsonPath("$.messages[0].content", equalTo("Summarize"))));
    }

    @Test
    void anthropicEmptyContentIsBackendError(WireMockRuntimeInfo wm) {
        stubFor(post(urlEqualTo("/v1/messages")).willReturn(okJson("{\"content\":[]}")));

        assertThatThrownBy(() -> backend("anthropic", "k", null, wm.getHttpBaseUrl() + "/v1/messages")
                .complete("p"))
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("empty response");
    }

    @Test
    void openAiUsesBearerTokenAndChoices(WireMockRuntimeInfo wm) {
        stubFor(post(urlEqualTo("/v1/chat/completions"))
                .willReturn(okJson("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"done\"}}]}")));

        RemoteCloudBackend backend = backend("OpenAI", "sk-test", "gpt-4o", wm.getHttpBaseUrl() + "/v1/chat/completions");

        assertThat(backend.complete("p")).isEqualTo("done");
        assertThat(backend.modelIdentifier()).isEqualTo("gpt-4o");
        verify(postRequestedFor(urlEqualTo("/v1/chat/completions"))
                .withHeader("Authorization", equalTo("Bearer sk-test"))
                .withRequestBody(matchingJsonPath("$.model", equalTo("gpt-4o"))));
    }

    @Test
    void providerErrorCarriesStatus(WireMockRuntimeInfo wm) {
        stubFor(post(urlEqualTo("/v1/messages"))
                .willReturn(aResponse().withStatus(401).withBody("{\"error\":\"invalid x-api-key\"}")));

        assertThatThrownBy(() -> backend("anthropic", "bad", null, wm.getHttpBaseUrl() + "/v1/messages")
                .complete("p"))
                .isInstanceOfSatisfying(BackendException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(401));
    }

    @Test
    void missingKeyFailsBeforeAnyRequest() {
        RemoteCloudBackend backend = backend("anthropic", "", null, "http://localhost:1/v1/messages");

        assertThatThrownBy(() -> backend.complete("p")).isInstanceOf(ConfigurationException.class);
        assertThat(backend.isAvailable()).isFalse();
        assertThat(backend.setupStatus())
                .isEqualTo(SetupStatus.notReady(backend.kind(), "API key not configured", "Add API key in Settings > AI"));
    }

    @Test
    void unknownProviderIsConfigurationError() {
        RemoteCloudBackend backend = backend("mistral", "key", "large", null);

        assertThatThrownBy(() -> backend.complete("p"))
                .isInstanceOfSatisfying(ConfigurationException.class,
                        e -> assertThat(e.getSetting()).isEqualTo("inference.cloud.provider"));
        assertThat(backend.setupStatus().ready()).isFalse();
        assertThat(backend.setupStatus().issue()).isEqualTo("Unknown cloud provider: mistral");
        assertThat(backend.setupStatus().suggestion()).isEqualTo("Select anthropic or openai");
        assertThat(backend.modelIdentifier()).isEqualTo("large");
    }

    @Test
    void configuredProviderIsReady() {
        RemoteCloudBackend backend = backend("anthropic", "key", null, null);

        assertThat(backend.setupStatus().ready()).isTrue();
        assertThat(backend.isAvailable()).isTrue();
        assertThat(backend.modelIdentifier()).isEqualTo("claude-3-5-haiku-latest");
    }
}
