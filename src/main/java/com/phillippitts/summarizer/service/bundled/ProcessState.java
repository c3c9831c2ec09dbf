package com.phillippitts.summarizer.service.bundled;

/**
 * Lifecycle of the bundled completion server as seen by {@link BundledProcessManager}.
 *
 * <pre>
 * STOPPED → STARTING → RUNNING_MANAGED | RUNNING_ADOPTED → STOPPING → STOPPED
 * </pre>
 */
public enum ProcessState {
    STOPPED,
    STARTING,
    /** Spawned by this manager; stop() terminates it. */
    RUNNING_MANAGED,
    /** A healthy server already held the port; stop() only forgets it. */
    RUNNING_ADOPTED,
    STOPPING;

    public boolean isRunning() {
        return this == RUNNING_MANAGED || this == RUNNING_ADOPTED;
    }
}
