package com.phillippitts.summarizer.service.bundled;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing knobs for starting and stopping the managed server.
 *
 * @param startup ceiling for the server to report healthy after spawn
 * @param pollInterval pause between health polls while starting
 * @param gracefulStop wait after {@link Process#destroy()} before force-killing
 * @param probe per-request timeout for health polls, further bounded by the remaining startup budget
 */
public record LifecycleTimeouts(Duration startup, Duration pollInterval, Duration gracefulStop, Duration probe) {

    public LifecycleTimeouts {
        Objects.requireNonNull(startup, "startup");
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(gracefulStop, "gracefulStop");
        Objects.requireNonNull(probe, "probe");
    }

    public static LifecycleTimeouts defaults() {
        return new LifecycleTimeouts(Duration.ofSeconds(30), Duration.ofMillis(500),
                Duration.ofSeconds(5), Duration.ofSeconds(2));
    }
}
