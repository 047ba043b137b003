package org.iscc.omero.tracker;

import org.iscc.omero.domain.AssetReference;
import org.iscc.omero.domain.FingerprintRecord;
import org.iscc.omero.source.RepositoryClient;
import org.iscc.omero.source.RepositorySession;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * Drops assets that already carry a fingerprint record in the namespace.
 * Check-then-write is not atomic against the repository.
 */
public class DeduplicationFilter {

    private static final Logger LOG = Logger.getLogger(DeduplicationFilter.class);

    private final RepositoryClient client;

    public DeduplicationFilter(RepositoryClient client) {
        this.client = client;
    }

    public boolean isProcessed(RepositorySession session, AssetReference asset, String namespace) {
        return client.recordExists(session, asset.id(), namespace);
    }

    /**
     * The stored record, for diagnostics.
     */
    public Optional<FingerprintRecord> existingRecord(RepositorySession session, AssetReference asset, String namespace) {
        Optional<FingerprintRecord> record = client.readRecord(session, asset.id(), namespace);
        record.ifPresent(r -> LOG.debugf("Asset %s already fingerprinted as %s by %s at %s",
                asset.id(), r.code(), r.processorIdentity(), r.computedAt()));
        return record;
    }
}
