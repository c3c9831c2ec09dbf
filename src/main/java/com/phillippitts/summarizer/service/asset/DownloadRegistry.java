package com.phillippitts.summarizer.service.asset;

import com.phillippitts.summarizer.exception.DownloadInProgressException;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-flight download markers keyed by asset id. One registry per downloader.
 */
final class DownloadRegistry {

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * Claims the id or fails immediately if another download holds it.
     *
     * @throws DownloadInProgressException if the id is already in flight
     */
    void acquire(String assetId) {
        if (!inFlight.add(assetId)) {
            throw new DownloadInProgressException(assetId);
        }
    }

    void release(String assetId) {
        inFlight.remove(assetId);
    }

    boolean isInFlight(String assetId) {
        return inFlight.contains(assetId);
    }
}
