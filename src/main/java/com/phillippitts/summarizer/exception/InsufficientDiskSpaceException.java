package com.phillippitts.summarizer.exception;

import java.util.Locale;

/**
 * Not enough usable space in the destination directory for the asset's expected size.
 * Raised before any network I/O.
 */
public class InsufficientDiskSpaceException extends AssetException {

    private static final double BYTES_PER_GB = 1024d * 1024d * 1024d;

    private final long availableBytes;
    private final long requiredBytes;

    public InsufficientDiskSpaceException(String assetId, long availableBytes, long requiredBytes) {
        super(assetId, String.format(Locale.ROOT,
                "insufficient disk space: %.1fGB available, %.1fGB required",
                availableBytes / BYTES_PER_GB, requiredBytes / BYTES_PER_GB));
        this.availableBytes = availableBytes;
        this.requiredBytes = requiredBytes;
    }

    public long getAvailableBytes() {
        return availableBytes;
    }

    public long getRequiredBytes() {
        return requiredBytes;
    }
}
