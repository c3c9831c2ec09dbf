package com.phillippitts.summarizer.domain;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * Static description of a downloadable unit. Not mutated at runtime.
 *
 * @param id stable identifier, also the de-duplication key of in-flight downloads
 * @param humanName display name
 * @param description one-line description
 * @param expectedSizeBytes approximate size; used for the disk-space preflight and as the
 *        progress total when the server omits Content-Length
 * @param sourceUrl download URL
 * @param localFilename final file name; for a server archive this is the executable to extract
 * @param kind model file or server archive
 * @param sharedLibraryPrefixes file name prefixes of runtime libraries extracted next to the executable
 */
public record AssetDescriptor(
        String id,
        String humanName,
        String description,
        long expectedSizeBytes,
        URI sourceUrl,
        String localFilename,
        AssetKind kind,
        List<String> sharedLibraryPrefixes
) {

    public AssetDescriptor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceUrl, "sourceUrl");
        Objects.requireNonNull(localFilename, "localFilename");
        Objects.requireNonNull(kind, "kind");
        humanName = Objects.requireNonNullElse(humanName, id);
        description = Objects.requireNonNullElse(description, "");
        sharedLibraryPrefixes = sharedLibraryPrefixes == null ? List.of() : List.copyOf(sharedLibraryPrefixes);
        if (expectedSizeBytes < 0) {
            throw new IllegalArgumentException("expectedSizeBytes must not be negative");
        }
    }

    public static AssetDescriptor model(String id, String humanName, String description,
                                        long expectedSizeBytes, String url, String localFilename) {
        return new AssetDescriptor(id, humanName, description, expectedSizeBytes, URI.create(url),
                localFilename, AssetKind.MODEL, List.of());
    }
}
