package org.iscc.omero.fingerprint;

import org.iscc.omero.domain.AssetReference;
import org.iscc.omero.domain.FileLocator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-process cache of computed fingerprints, keyed by an asset's raw files (locator id
 * and size) and its import time. An asset rediscovered after a failed record write is not
 * read again.
 */
public class FingerprintCache {

    public static final int DEFAULT_CAPACITY = 1024;

    private final Map<String, Fingerprint> entries;

    public FingerprintCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Fingerprint> eldest) {
                return size() > capacity;
            }
        };
    }

    public synchronized Optional<Fingerprint> get(AssetReference asset) {
        return Optional.ofNullable(entries.get(key(asset)));
    }

    public synchronized void put(AssetReference asset, Fingerprint fingerprint) {
        entries.put(key(asset), fingerprint);
    }

    public synchronized int size() {
        return entries.size();
    }

    static String key(AssetReference asset) {
        StringBuilder key = new StringBuilder().append(asset.importTimestamp().toEpochMilli());
        for (FileLocator locator : asset.rawFileLocators()) {
            key.append('|').append(locator.id()).append(':').append(locator.sizeBytes());
        }
        return key.toString();
    }
}
