package com.phillippitts.summarizer.domain;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Fixed sampling parameters and request timeout for completion calls.
 */
public record GenerationOptions(int maxTokens, double temperature, List<String> stopSequences, Duration timeout) {

    public static final int DEFAULT_MAX_TOKENS = 1024;
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    public GenerationOptions {
        if (maxTokens <= 0) {
            maxTokens = DEFAULT_MAX_TOKENS;
        }
        stopSequences = stopSequences == null ? List.of() : List.copyOf(stopSequences);
        timeout = Objects.requireNonNullElse(timeout, DEFAULT_TIMEOUT);
    }

    public static GenerationOptions defaults() {
        return new GenerationOptions(DEFAULT_MAX_TOKENS, DEFAULT_TEMPERATURE, List.of("\n\n\n"), DEFAULT_TIMEOUT);
    }
}
