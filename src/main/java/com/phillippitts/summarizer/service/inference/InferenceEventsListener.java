package com.phillippitts.summarizer.service.inference;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs generation failures with a hint for the operator. Throttled per backend and reason.
 */
@Component
class InferenceEventsListener {
    private static final Logger LOG = LogManager.getLogger(InferenceEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    @EventListener
    void onInferenceFailure(InferenceFailureEvent e) {
        String key = e.backend() + '-' + e.reason();
        if (!shouldLog(key)) {
            return;
        }
        LOG.warn("Summary generation failed: backend={}, reason={}, message={}{}",
                e.backend(), e.reason(), e.message(), hint(e.reason()));
    }

    private static String hint(String reason) {
        return switch (reason) {
            case "timeout" -> ". The model may still be loading; consider raising inference.timeouts.*";
            case "network" -> ". Check that the backend host is reachable.";
            case "configuration" -> ". Review inference.* settings.";
            case "port_conflict" -> ". Another process holds inference.bundled.port.";
            default -> "";
        };
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
