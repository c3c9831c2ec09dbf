package com.phillippitts.summarizer.util;

import java.time.Duration;

/**
 * Fixed timeout values for subprocess and thread management.
 *
 * <p>Startup, probe, generation and graceful-stop ceilings are configurable through
 * {@code inference.timeouts.*}; the values here cover the short internal waits that are not.
 *
 * @see com.phillippitts.summarizer.service.bundled.BundledProcessManager
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for the stderr gobbler thread during cleanup (best-effort).
     *
     * <p>Daemon thread; if it does not terminate it is killed on JVM exit.
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Wait after interrupting a stale server left by a previous run before escalating to a kill.
     */
    public static final Duration STALE_PROCESS_GRACE = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     *
     * <p>Processes that survive this are typically unkillable due to OS bugs.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
