package org.iscc.omero.monitor;

import org.iscc.omero.domain.AssetReference;
import org.iscc.omero.domain.Batch;
import org.iscc.omero.domain.Cursor;
import org.iscc.omero.exception.RepositoryUnavailableException;
import org.iscc.omero.source.RepositoryClient;
import org.iscc.omero.source.RepositorySession;
import org.jboss.logging.Logger;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Discovers assets imported after the cursor.
 * The client result is re-filtered, re-sorted and re-bounded so overlap from the
 * repository never reaches the pipeline.
 */
public class AssetMonitor {

    private static final Logger LOG = Logger.getLogger(AssetMonitor.class);

    private static final Comparator<AssetReference> IMPORT_ORDER = Comparator
            .comparing(AssetReference::importTimestamp)
            .thenComparing(AssetReference::id);

    private final RepositoryClient client;

    public AssetMonitor(RepositoryClient client) {
        this.client = client;
    }

    /**
     * Poll for the next batch after {@code cursor}.
     *
     * @return up to {@code batchSize} assets, ascending by import time then id; empty when nothing is new
     * @throws RepositoryUnavailableException if the query cannot complete
     */
    public Batch poll(RepositorySession session, Cursor cursor, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }

        List<AssetReference> found = client.queryNewAssets(
                session, cursor.lastSeenTimestamp(), cursor.lastSeenId(), batchSize);

        List<AssetReference> assets = found.stream()
                .filter(cursor::precedes)
                .sorted(IMPORT_ORDER)
                .limit(batchSize)
                .collect(Collectors.toList());

        if (assets.size() < found.size()) {
            LOG.debugf("Dropped %d assets at or before cursor %s", found.size() - assets.size(), cursor);
        }
        if (!assets.isEmpty()) {
            LOG.debugf("Poll after %s returned %d assets", cursor, assets.size());
        }

        return new Batch(assets);
    }
}
