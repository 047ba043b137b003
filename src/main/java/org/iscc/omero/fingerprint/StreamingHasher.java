package org.iscc.omero.fingerprint;

import java.util.Map;

/**
 * Incremental hash: any split of the input into updates yields the same final code.
 * Single use; {@link #finish()} may be called once.
 */
public interface StreamingHasher {

    void update(byte[] data, int offset, int length);

    String finish();

    /**
     * Identifier of the algorithm and its version, persisted next to every code.
     */
    String version();

    /**
     * Additional values derived from the same input, stored next to the code. Available after
     * {@link #finish()}.
     */
    default Map<String, String> units() {
        return Map.of();
    }
}
