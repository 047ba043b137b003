package org.iscc.omero.domain;

import java.util.List;

/**
 * Ordered slice of new assets produced by a single poll.
 */
public record Batch(List<AssetReference> assets) {

    public Batch {
        assets = assets != null ? List.copyOf(assets) : List.of();
    }

    public boolean isEmpty() {
        return assets.isEmpty();
    }

    public int size() {
        return assets.size();
    }
}
