package org.iscc.omero.fingerprint;

import java.util.Map;

/**
 * Finalized code together with the algorithm version that produced it and the units derived
 * from the same bytes.
 */
public record Fingerprint(String code, String algorithmVersion, long bytesProcessed, Map<String, String> units) {

    public Fingerprint {
        units = units != null ? Map.copyOf(units) : Map.of();
    }
}
