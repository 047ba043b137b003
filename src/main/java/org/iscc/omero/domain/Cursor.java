package org.iscc.omero.domain;

import java.time.Instant;
import java.util.Comparator;

/**
 * Bookmark into the repository's import timeline.
 * Ordered by timestamp, then by asset id; only ever moves forward.
 */
public record Cursor(
        Instant lastSeenTimestamp,
        String lastSeenId
) implements Comparable<Cursor> {

    private static final Comparator<Cursor> ORDER = Comparator
            .comparing(Cursor::lastSeenTimestamp)
            .thenComparing(Cursor::lastSeenId);

    public Cursor {
        if (lastSeenTimestamp == null) {
            throw new IllegalArgumentException("lastSeenTimestamp cannot be null");
        }
        lastSeenId = lastSeenId != null ? lastSeenId : "";
    }

    /**
     * Cursor positioned before every asset.
     */
    public static Cursor initial() {
        return new Cursor(Instant.EPOCH, "");
    }

    public static Cursor at(AssetReference asset) {
        return new Cursor(asset.importTimestamp(), asset.id());
    }

    /**
     * True if the asset lies strictly after this cursor position.
     */
    public boolean precedes(AssetReference asset) {
        return compareTo(at(asset)) < 0;
    }

    /**
     * Move past the given asset. Never moves backward: an asset at or before
     * the current position returns this cursor unchanged.
     */
    public Cursor advance(AssetReference asset) {
        return precedes(asset) ? at(asset) : this;
    }

    @Override
    public int compareTo(Cursor other) {
        return ORDER.compare(this, other);
    }
}
