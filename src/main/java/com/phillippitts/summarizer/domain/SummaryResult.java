package com.phillippitts.summarizer.domain;

import java.util.List;
import java.util.Objects;

/**
 * Output aggregate for one generation request. Constructed fresh per request, never cached.
 *
 * @param summary short summary text (never null)
 * @param explanation longer explanation (may be empty)
 * @param tags free-text tags
 * @param confidence overall confidence
 * @param projects per-project time/activity breakdown
 * @param modelUsed resolved model identifier, e.g. {@code bundled:gemma-2-2b-it-q4_k_m.gguf}
 * @param inferenceMs wall-clock latency of the backend call in milliseconds
 */
public record SummaryResult(
        String summary,
        String explanation,
        List<String> tags,
        Confidence confidence,
        List<ProjectBreakdown> projects,
        String modelUsed,
        long inferenceMs
) {

    public SummaryResult {
        Objects.requireNonNull(summary, "summary must not be null");
        explanation = Objects.requireNonNullElse(explanation, "");
        tags = tags == null ? List.of() : List.copyOf(tags);
        confidence = Objects.requireNonNullElse(confidence, Confidence.MEDIUM);
        projects = projects == null ? List.of() : List.copyOf(projects);
        modelUsed = Objects.requireNonNullElse(modelUsed, "");
        if (inferenceMs < 0) {
            throw new IllegalArgumentException("inferenceMs must not be negative: " + inferenceMs);
        }
    }

    /**
     * Returns a copy carrying the model identifier and measured latency.
     */
    public SummaryResult withInference(String model, long latencyMs) {
        return new SummaryResult(summary, explanation, tags, confidence, projects, model, latencyMs);
    }
}
