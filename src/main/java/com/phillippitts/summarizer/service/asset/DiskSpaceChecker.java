package com.phillippitts.summarizer.service.asset;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reports usable space for the file store containing a directory.
 */
@FunctionalInterface
public interface DiskSpaceChecker {

    long usableBytes(Path directory) throws IOException;
}
