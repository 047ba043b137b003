package org.iscc.omero.orchestration;

public enum OrchestratorState {
    DISCONNECTED,
    CONNECTING,
    POLLING,
    PROCESSING,
    STOPPING,
    STOPPED
}
