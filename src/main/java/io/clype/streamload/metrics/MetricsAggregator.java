package io.clype.streamload.metrics;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

import io.clype.streamload.model.MetricsSnapshot;

/**
 * Process-wide lifecycle counters shared by every worker of a pool.
 *
 * <p>All four counters are monotonic and guarded by a single monitor, so increments
 * are linearizable and {@link #snapshot()} never returns a torn state: every snapshot
 * is the result of some prefix of the increment history.</p>
 *
 * <p>The start time is set on the first counter change and never moves afterwards.</p>
 *
 * <p><b>Thread Safety:</b> This class is thread-safe.</p>
 */
public class MetricsAggregator {

    private final Clock clock;

    private long connectedTotal;
    private long disconnectedTotal;
    private long errorTotal;
    private long messageTotal;
    private Instant startTime;

    /**
     * Creates an aggregator using the system UTC clock.
     */
    public MetricsAggregator() {
        this(Clock.systemUTC());
    }

    /**
     * Creates an aggregator using the given clock for the start timestamp.
     *
     * @param clock clock used to stamp the first activity
     */
    public MetricsAggregator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /** Records a connection that reached the connected phase. */
    public synchronized void recordConnected() {
        markActivity();
        connectedTotal++;
    }

    /**
     * Records the end of an established connection.
     *
     * @param abnormal true if the connection dropped with an error rather than closing cleanly
     */
    public synchronized void recordDisconnected(boolean abnormal) {
        markActivity();
        disconnectedTotal++;
        if (abnormal) {
            errorTotal++;
        }
    }

    /** Records a connection attempt that failed before reaching the connected phase. */
    public synchronized void recordConnectFailure() {
        markActivity();
        errorTotal++;
    }

    /** Records one received message. */
    public synchronized void recordMessage() {
        markActivity();
        messageTotal++;
    }

    /**
     * Returns a consistent copy of all counters.
     *
     * @return the current snapshot
     */
    public synchronized MetricsSnapshot snapshot() {
        return new MetricsSnapshot(connectedTotal, disconnectedTotal, errorTotal, messageTotal, startTime);
    }

    /**
     * Returns the clock used by this aggregator.
     *
     * @return the clock
     */
    public Clock clock() {
        return clock;
    }

    private void markActivity() {
        if (startTime == null) {
            startTime = clock.instant();
        }
    }
}
