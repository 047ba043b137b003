package org.iscc.omero.orchestration;

/**
 * How a run ended, with the final status.
 */
public record RunSummary(Outcome outcome, OrchestratorStatus status) {

    public enum Outcome {
        /** {@code --once} cycle finished. */
        COMPLETED,
        /** Stop requested. */
        STOPPED,
        /** Repository never reachable within the startup attempts. */
        CONNECT_FAILED
    }
}
