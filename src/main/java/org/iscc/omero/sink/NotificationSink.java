package org.iscc.omero.sink;

import org.iscc.omero.domain.AssetReference;
import org.iscc.omero.domain.FingerprintRecord;
import org.iscc.omero.exception.NotificationException;

/**
 * Best-effort side channel invoked after a fingerprint record is committed.
 */
public interface NotificationSink {

    /**
     * @throws NotificationException if delivery failed
     */
    void notifyCommitted(AssetReference asset, FingerprintRecord record);
}
