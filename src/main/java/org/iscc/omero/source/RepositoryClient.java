package org.iscc.omero.source;

import org.iscc.omero.domain.AssetReference;
import org.iscc.omero.domain.FileLocator;
import org.iscc.omero.domain.FingerprintRecord;
import org.iscc.omero.exception.RecordWriteException;
import org.iscc.omero.exception.RepositoryUnavailableException;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Query, stream and annotate operations of the media repository.
 * Every operation except {@link #connect} throws {@link RepositoryUnavailableException}
 * when the session is no longer usable.
 */
public interface RepositoryClient {

    /**
     * @throws RepositoryUnavailableException on network or authentication failure
     */
    RepositorySession connect(String host, int port, Credentials credentials);

    /**
     * Assets imported after {@code (sinceTimestamp, sinceId)}, ascending by import time then id,
     * at most {@code limit} entries.
     */
    List<AssetReference> queryNewAssets(RepositorySession session, Instant sinceTimestamp, String sinceId, int limit);

    /**
     * Open the raw bytes behind a locator. The caller closes the stream.
     *
     * @throws IOException if the locator cannot be opened
     */
    InputStream openRawStream(RepositorySession session, FileLocator locator) throws IOException;

    boolean recordExists(RepositorySession session, String assetId, String namespace);

    Optional<FingerprintRecord> readRecord(RepositorySession session, String assetId, String namespace);

    /**
     * @throws RecordWriteException if the record could not be stored
     */
    void writeRecord(RepositorySession session, String assetId, FingerprintRecord record);

    void close(RepositorySession session);
}
