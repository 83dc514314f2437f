package io.clype.streamload.model;

/**
 * Lifecycle of a worker pool as a whole.
 *
 * <p>Transitions only move forward: {@code IDLE -> STARTING -> RUNNING -> STOPPING -> STOPPED}.
 * A stop requested while {@code STARTING} skips the rest of the launch sequence but still
 * passes through {@code RUNNING}.</p>
 */
public enum PoolState {
    IDLE,
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED
}
