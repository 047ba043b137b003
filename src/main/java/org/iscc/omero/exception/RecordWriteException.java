package org.iscc.omero.exception;

/**
 * Writing a fingerprint record failed.
 */
public class RecordWriteException extends IsccServiceException {

    public RecordWriteException(String assetId, String namespace, String message) {
        super("WRITE_ERROR", "write_record",
                String.format("asset=%s, namespace=%s: %s", assetId, namespace, message));
    }

    public RecordWriteException(String assetId, String namespace, String message, Throwable cause) {
        super("WRITE_ERROR", "write_record",
                String.format("asset=%s, namespace=%s: %s", assetId, namespace, message), cause);
    }
}
