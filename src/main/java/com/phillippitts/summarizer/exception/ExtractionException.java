package com.phillippitts.summarizer.exception;

import java.util.List;

/**
 * The server archive was malformed or did not contain the target executable.
 */
public class ExtractionException extends AssetException {

    private final List<String> candidates;

    public ExtractionException(String assetId, String message, Throwable cause) {
        super(assetId, message, cause);
        this.candidates = List.of();
    }

    public ExtractionException(String assetId, String targetFilename, List<String> candidates) {
        super(assetId, "server binary " + targetFilename + " not found in archive (found: " + candidates + ")");
        this.candidates = List.copyOf(candidates);
    }

    public List<String> getCandidates() {
        return candidates;
    }
}
