package org.iscc.omero.fingerprint;

import java.io.IOException;
import java.io.InputStream;

/**
 * Lazily opened byte source for one raw file of an asset.
 */
public record RawSource(String name, long sizeBytes, Opener opener) {

    @FunctionalInterface
    public interface Opener {
        InputStream open() throws IOException;
    }

    public RawSource {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        if (opener == null) {
            throw new IllegalArgumentException("opener cannot be null");
        }
    }

    public InputStream open() throws IOException {
        return opener.open();
    }
}
