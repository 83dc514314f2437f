package io.clype.streamload.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Consistent read of all pool counters at one instant.
 *
 * @param connectedTotal    connections that reached the connected phase
 * @param disconnectedTotal established connections that ended (cleanly or not)
 * @param errorTotal        failed connection attempts plus abnormal closures
 * @param messageTotal      messages received across all connections
 * @param startTime         time of the first recorded counter change, or null if none yet
 */
public record MetricsSnapshot(
    long connectedTotal,
    long disconnectedTotal,
    long errorTotal,
    long messageTotal,
    Instant startTime
) {

    /** Snapshot of a pool that has recorded nothing yet. */
    public static final MetricsSnapshot EMPTY = new MetricsSnapshot(0, 0, 0, 0, null);

    /**
     * Returns whether any counter has changed since the aggregator was created.
     *
     * @return true once the first activity was recorded
     */
    public boolean hasActivity() {
        return startTime != null;
    }

    /**
     * Returns the number of connections currently open.
     *
     * @return connected minus disconnected
     */
    public long openConnections() {
        return connectedTotal - disconnectedTotal;
    }

    /**
     * Returns the time elapsed since the first activity.
     *
     * @param now the current instant
     * @return elapsed time, or zero if there was no activity yet
     */
    public Duration elapsedAt(Instant now) {
        return startTime == null ? Duration.ZERO : Duration.between(startTime, now);
    }
}
