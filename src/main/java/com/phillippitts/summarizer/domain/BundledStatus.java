package com.phillippitts.summarizer.domain;

/**
 * Snapshot of the bundled server state plus filesystem checks.
 *
 * @param available model and executable both present
 * @param running process is serving (managed or adopted)
 * @param modelPresent model file exists
 * @param executablePresent server executable exists
 * @param modelPath configured model path
 * @param serverPath configured executable path
 * @param port configured port
 * @param state lifecycle state name
 */
public record BundledStatus(
        boolean available,
        boolean running,
        boolean modelPresent,
        boolean executablePresent,
        String modelPath,
        String serverPath,
        int port,
        String state
) {

    public static BundledStatus notConfigured() {
        return new BundledStatus(false, false, false, false, "", "", 0, "STOPPED");
    }
}
