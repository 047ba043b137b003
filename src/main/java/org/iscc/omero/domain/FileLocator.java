package org.iscc.omero.domain;

/**
 * Opaque handle to one raw file backing an asset.
 */
public record FileLocator(
        String id,
        String name,
        long sizeBytes
) {
    public FileLocator {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("locator id cannot be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("locator name cannot be blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes cannot be negative");
        }
    }
}
