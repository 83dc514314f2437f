package io.clype.streamload.model;

/**
 * Lifecycle phase of a single connection worker.
 */
public enum WorkerPhase {
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    STOPPED
}
