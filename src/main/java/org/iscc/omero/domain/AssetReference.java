package org.iscc.omero.domain;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of an asset as returned by a repository query.
 * Raw file locators are kept in the order their bytes are concatenated for fingerprinting.
 */
public record AssetReference(
        String id,
        String name,
        Instant importTimestamp,
        List<FileLocator> rawFileLocators
) {
    public AssetReference {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Asset id cannot be blank");
        }
        if (importTimestamp == null) {
            throw new IllegalArgumentException("importTimestamp cannot be null");
        }
        name = name != null ? name : id;
        rawFileLocators = rawFileLocators != null ? List.copyOf(rawFileLocators) : List.of();
    }

    /**
     * Name of the file the fingerprint is attributed to: the first raw file, or the asset name
     * when the asset has no raw files.
     */
    public String primaryFileName() {
        return rawFileLocators.isEmpty() ? name : rawFileLocators.get(0).name();
    }
}
