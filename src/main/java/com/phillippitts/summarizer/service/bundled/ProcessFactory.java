package com.phillippitts.summarizer.service.bundled;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Abstraction over {@link ProcessBuilder} to enable hermetic testing of the server lifecycle.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests provide a stub returning a fake
 * {@link Process} with controlled liveness, stderr and exit code.
 */
public interface ProcessFactory {
    /**
     * Starts a new process.
     *
     * @param command full command line, with the executable as the first element
     * @param workingDir working directory for the process (may be null)
     * @param environment variables added to the inherited environment
     * @return started {@link Process}
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir, Map<String, String> environment) throws IOException;
}
