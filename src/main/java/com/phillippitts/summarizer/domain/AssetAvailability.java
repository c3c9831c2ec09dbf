package com.phillippitts.summarizer.domain;

/**
 * Catalog entry joined with local state.
 *
 * @param descriptor catalog entry
 * @param downloaded whether the final file exists locally
 * @param sizeBytes actual on-disk size when downloaded, otherwise the expected size
 * @param downloading whether a download is currently in flight
 */
public record AssetAvailability(AssetDescriptor descriptor, boolean downloaded, long sizeBytes, boolean downloading) {
}
