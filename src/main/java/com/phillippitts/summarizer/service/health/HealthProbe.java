package com.phillippitts.summarizer.service.health;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Liveness probe for HTTP inference endpoints.
 *
 * <p>Every failure mode (connection refused, timeout, non-2xx, malformed URL, interruption)
 * collapses to {@code false}. Callers that need the reason use their own client.
 */
public class HealthProbe {

    private static final Logger LOG = LogManager.getLogger(HealthProbe.class);

    private final HttpClient client;
    private final Duration timeout;

    public HealthProbe(HttpClient client, Duration timeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * Returns a probe sharing this probe's client with a different per-request timeout.
     */
    public HealthProbe withTimeout(Duration newTimeout) {
        return new HealthProbe(client, newTimeout);
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * GET {@code {baseUrl}/health}; true only for a 2xx answer.
     */
    public boolean isHealthy(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            return false;
        }
        return isReachable(stripTrailingSlash(baseUrl) + "/health");
    }

    /**
     * GET an arbitrary URL; true only for a 2xx answer.
     */
    public boolean isReachable(String url) {
        return status(url) / 100 == 2;
    }

    /**
     * GET an arbitrary URL and return its status code, or {@code -1} when no answer was received.
     */
    public int status(String url) {
        if (url == null || url.isBlank()) {
            return -1;
        }
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .GET()
                    .build();
            HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
            return response.statusCode();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Probe of {} interrupted", url);
            return -1;
        } catch (IOException | IllegalArgumentException e) {
            LOG.trace("Probe of {} failed: {}", url, e.toString());
            return -1;
        }
    }

    private static String stripTrailingSlash(String url) {
        String result = url.trim();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
