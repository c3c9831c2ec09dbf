package com.phillippitts.summarizer.service.backend;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Registry of supported remote providers.
 */
public final class CloudProviders {

    private static final List<CloudProvider> PROVIDERS = List.of(new AnthropicProvider(), new OpenAiProvider());

    private CloudProviders() {
        // Utility class - prevent instantiation
    }

    public static Optional<CloudProvider> forName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return PROVIDERS.stream().filter(p -> p.name().equals(normalized)).findFirst();
    }

    public static List<String> names() {
        return PROVIDERS.stream().map(CloudProvider::name).toList();
    }
}
