package com.phillippitts.summarizer.service.inference;

import java.time.Instant;
import java.util.Map;

/**
 * Published when summary generation fails.
 *
 * <p>Privacy note: never put prompt or reply text in context. Restrict to technical diagnostics.
 */
public record InferenceFailureEvent(
        String backend,
        Instant at,
        String reason,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public InferenceFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
