package com.phillippitts.summarizer.service.asset;

/**
 * Receives byte-level progress after each chunk written to disk.
 */
@FunctionalInterface
public interface DownloadProgressListener {

    DownloadProgressListener NONE = (bytesSoFar, totalBytes) -> { };

    /**
     * @param bytesSoFar bytes written so far
     * @param totalBytes Content-Length, or the descriptor's expected size when the server sent none
     */
    void onProgress(long bytesSoFar, long totalBytes);
}
