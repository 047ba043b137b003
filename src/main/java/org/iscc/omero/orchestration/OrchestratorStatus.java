package org.iscc.omero.orchestration;

import org.iscc.omero.domain.Cursor;

import java.time.Instant;

/**
 * Point-in-time view of a running orchestrator.
 */
public record OrchestratorStatus(
        OrchestratorState state,
        boolean connected,
        Cursor cursor,
        long committed,
        long alreadyProcessed,
        long skipped,
        long cycles,
        Instant lastPollAt
) {
}
