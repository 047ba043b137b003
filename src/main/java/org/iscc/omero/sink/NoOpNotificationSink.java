package org.iscc.omero.sink;

import org.iscc.omero.domain.AssetReference;
import org.iscc.omero.domain.FingerprintRecord;

public final class NoOpNotificationSink implements NotificationSink {

    public static final NoOpNotificationSink INSTANCE = new NoOpNotificationSink();

    private NoOpNotificationSink() {
    }

    @Override
    public void notifyCommitted(AssetReference asset, FingerprintRecord record) {
        // nothing configured
    }
}
