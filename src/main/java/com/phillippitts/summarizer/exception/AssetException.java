package com.phillippitts.summarizer.exception;

/**
 * Base class for asset acquisition failures (model weights, server bundles).
 */
public class AssetException extends SummarizerException {

    private final String assetId;

    public AssetException(String assetId, String message) {
        super(message);
        this.assetId = assetId;
    }

    public AssetException(String assetId, String message, Throwable cause) {
        super(message, cause);
        this.assetId = assetId;
    }

    public String getAssetId() {
        return assetId;
    }
}
