package com.phillippitts.summarizer.domain;

import com.phillippitts.summarizer.exception.ConfigurationException;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Externally-running local service. The service is assumed to be running already.
 *
 * @param hostUrl base URL, e.g. {@code http://localhost:11434}
 * @param modelIdentifier model tag as listed by {@code /api/tags}
 * @throws ConfigurationException when the host is not an absolute http(s) URL
 */
public record ExternalLocalParameters(String hostUrl, String modelIdentifier) implements BackendSettings {

    public static final String DEFAULT_HOST = "http://localhost:11434";

    public ExternalLocalParameters {
        hostUrl = hostUrl == null || hostUrl.isBlank() ? DEFAULT_HOST : stripTrailingSlash(hostUrl.trim());
        requireHttpUrl(hostUrl);
    }

    @Override
    public BackendKind kind() {
        return BackendKind.EXTERNAL_LOCAL;
    }

    private static void requireHttpUrl(String url) {
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw invalidHost(url);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                || uri.getHost() == null) {
            throw invalidHost(url);
        }
    }

    private static ConfigurationException invalidHost(String url) {
        return new ConfigurationException("inference.external.host",
                "Invalid Ollama host '" + url + "': use a URL such as " + DEFAULT_HOST);
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
