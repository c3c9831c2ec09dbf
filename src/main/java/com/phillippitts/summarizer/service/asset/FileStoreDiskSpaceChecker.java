package com.phillippitts.summarizer.service.asset;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link DiskSpaceChecker} backed by {@link java.nio.file.FileStore#getUsableSpace()}.
 */
public final class FileStoreDiskSpaceChecker implements DiskSpaceChecker {

    @Override
    public long usableBytes(Path directory) throws IOException {
        return Files.getFileStore(directory).getUsableSpace();
    }
}
