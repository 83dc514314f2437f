package io.clype.streamload.report;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

import io.clype.streamload.model.MetricsSnapshot;
import io.clype.streamload.model.StatsSample;

/**
 * Turns successive snapshots into samples with a rolling message rate.
 *
 * <p>{@code rate = (current.messageTotal - previous.messageTotal) / interval}. The first
 * sample has no predecessor and therefore no rate. When ticks were skipped between two
 * samples, the delta is divided by every interval it covers.</p>
 *
 * <p>Not thread-safe; one instance per reporting stream.</p>
 */
public class StatsSampler {

    private final double intervalSeconds;
    private MetricsSnapshot previous;
    private long previousTick = -1;

    /**
     * Creates a sampler for a fixed sampling interval.
     *
     * @param interval time between two samples
     */
    public StatsSampler(Duration interval) {
        Objects.requireNonNull(interval, "interval cannot be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.intervalSeconds = interval.toNanos() / 1_000_000_000.0;
    }

    /**
     * Produces the sample for the tick following the previous one.
     *
     * @param current the snapshot taken at this tick
     * @param now     the instant of this tick
     * @return the sample
     */
    public StatsSample sample(MetricsSnapshot current, Instant now) {
        return sample(previousTick + 1, current, now);
    }

    /**
     * Produces the sample for the given tick and remembers the snapshot for the next one.
     *
     * @param tick    zero-based tick index; must be greater than the previous one
     * @param current the snapshot taken at this tick
     * @param now     the instant of this tick
     * @return the sample
     */
    public StatsSample sample(long tick, MetricsSnapshot current, Instant now) {
        if (tick <= previousTick) {
            throw new IllegalArgumentException("tick " + tick + " does not follow tick " + previousTick);
        }
        OptionalDouble rate = previous == null
                ? OptionalDouble.empty()
                : OptionalDouble.of((current.messageTotal() - previous.messageTotal())
                        / ((tick - previousTick) * intervalSeconds));
        previous = current;
        previousTick = tick;
        return new StatsSample(current.elapsedAt(now), current, rate);
    }
}
