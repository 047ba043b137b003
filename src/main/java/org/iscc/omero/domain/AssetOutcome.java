package org.iscc.omero.domain;

/**
 * Result of running one asset through the pipeline.
 */
public record AssetOutcome(
        String assetId,
        Status status,
        String code,
        String message
) {
    public enum Status {
        COMMITTED,
        ALREADY_PROCESSED,
        SKIPPED_UNREADABLE,
        CONNECTION_FAULT
    }

    public static AssetOutcome committed(String assetId, String code) {
        return new AssetOutcome(assetId, Status.COMMITTED, code, null);
    }

    public static AssetOutcome alreadyProcessed(String assetId) {
        return new AssetOutcome(assetId, Status.ALREADY_PROCESSED, null, "Fingerprint record exists");
    }

    public static AssetOutcome unreadable(String assetId, String reason) {
        return new AssetOutcome(assetId, Status.SKIPPED_UNREADABLE, null, reason);
    }

    public static AssetOutcome connectionFault(String assetId, String reason) {
        return new AssetOutcome(assetId, Status.CONNECTION_FAULT, null, reason);
    }

    /**
     * Whether the cursor may move past this asset.
     */
    public boolean handled() {
        return status != Status.CONNECTION_FAULT;
    }
}
