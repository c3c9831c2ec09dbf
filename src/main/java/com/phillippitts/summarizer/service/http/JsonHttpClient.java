package com.phillippitts.summarizer.service.http;

import com.phillippitts.summarizer.exception.BackendException;
import com.phillippitts.summarizer.exception.InferenceExceptionBuilder;
import com.phillippitts.summarizer.exception.NetworkException;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Thin JSON-over-HTTP helper shared by the inference backends.
 *
 * <p>Failure mapping: transport errors and interruption become {@link NetworkException},
 * non-2xx answers become {@link BackendException} carrying status and body, and a 2xx body
 * that is not a JSON object becomes an {@link com.phillippitts.summarizer.exception.InferenceException}.
 */
public class JsonHttpClient {

    private final HttpClient client;

    public JsonHttpClient(HttpClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public HttpClient httpClient() {
        return client;
    }

    /**
     * POST a JSON body and decode the JSON object answer.
     *
     * @param backend backend name used in error messages
     */
    public JSONObject postJson(String backend, URI uri, JSONObject body, Map<String, String> headers,
                               Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8));
        headers.forEach(builder::header);
        return parse(backend, uri, sendForString(backend, uri, builder.build()));
    }

    /**
     * GET a URI and decode the JSON object answer.
     */
    public JSONObject getJson(String backend, URI uri, Duration timeout) {
        return parse(backend, uri, getString(backend, uri, timeout));
    }

    /**
     * GET a URI and return the raw 2xx body.
     */
    public String getString(String backend, URI uri, Duration timeout) {
        HttpRequest request = HttpRequest.newBuilder(uri).timeout(timeout).GET().build();
        return sendForString(backend, uri, request);
    }

    private String sendForString(String backend, URI uri, HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new NetworkException(uri.toString(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException(uri.toString(), e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new BackendException(backend, response.statusCode(), response.body());
        }
        return response.body();
    }

    private static JSONObject parse(String backend, URI uri, String body) {
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            throw InferenceExceptionBuilder.create("Malformed response")
                    .backend(backend)
                    .metadata("uri", uri)
                    .cause(e)
                    .build();
        }
    }
}
