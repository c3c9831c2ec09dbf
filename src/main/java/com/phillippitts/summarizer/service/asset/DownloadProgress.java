package com.phillippitts.summarizer.service.asset;

/**
 * Last known state of a background download.
 *
 * @param assetId catalog id
 * @param state running, completed or failed
 * @param bytesSoFar bytes written so far
 * @param totalBytes expected total
 * @param error failure message (empty unless failed)
 */
public record DownloadProgress(String assetId, State state, long bytesSoFar, long totalBytes, String error) {

    public enum State { RUNNING, COMPLETED, FAILED }

    static DownloadProgress started(String assetId, long expectedBytes) {
        return new DownloadProgress(assetId, State.RUNNING, 0, expectedBytes, "");
    }

    DownloadProgress advance(long bytes, long total) {
        return new DownloadProgress(assetId, State.RUNNING, bytes, total, "");
    }

    DownloadProgress completed() {
        return new DownloadProgress(assetId, State.COMPLETED, totalBytes, totalBytes, "");
    }

    DownloadProgress failed(String message) {
        return new DownloadProgress(assetId, State.FAILED, bytesSoFar, totalBytes,
                message == null ? "download failed" : message);
    }

    /**
     * Percent complete, 0..100.
     */
    public int percent() {
        if (totalBytes <= 0) {
            return 0;
        }
        return (int) Math.min(100, bytesSoFar * 100 / totalBytes);
    }
}
