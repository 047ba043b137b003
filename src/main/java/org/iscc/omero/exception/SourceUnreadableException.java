package org.iscc.omero.exception;

/**
 * Raw bytes of an asset cannot be read. The asset is skipped and not retried.
 */
public class SourceUnreadableException extends IsccServiceException {

    private final String source;

    public SourceUnreadableException(String operation, String source, String message) {
        super("SOURCE_UNREADABLE", operation, String.format("%s: %s", source, message));
        this.source = source;
    }

    public SourceUnreadableException(String operation, String source, String message, Throwable cause) {
        super("SOURCE_UNREADABLE", operation, String.format("%s: %s", source, message), cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }

    public static SourceUnreadableException noRawFiles(String assetId) {
        return new SourceUnreadableException("compute", assetId, "Asset has no raw files");
    }
}
