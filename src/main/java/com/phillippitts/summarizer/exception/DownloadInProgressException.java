package com.phillippitts.summarizer.exception;

/**
 * Another download of the same asset id is already in flight on this downloader.
 */
public class DownloadInProgressException extends AssetException {

    public DownloadInProgressException(String assetId) {
        super(assetId, "asset " + assetId + " is already being downloaded");
    }
}
