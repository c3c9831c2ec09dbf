package com.phillippitts.summarizer.domain;

/**
 * What a downloadable asset is.
 */
public enum AssetKind {
    /** Single model weight file written as-is. */
    MODEL,
    /** Compressed archive holding the server executable and its shared libraries. */
    SERVER_ARCHIVE
}
