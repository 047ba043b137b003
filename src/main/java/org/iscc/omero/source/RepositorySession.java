package org.iscc.omero.source;

import java.time.Instant;

/**
 * Handle to an open repository connection. Owned by a single orchestrator and
 * discarded after any fault.
 */
public record RepositorySession(
        String id,
        String host,
        int port,
        String username,
        Instant openedAt
) {
    public RepositorySession {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Session id cannot be blank");
        }
    }

    public String endpoint() {
        return host + ":" + port;
    }
}
