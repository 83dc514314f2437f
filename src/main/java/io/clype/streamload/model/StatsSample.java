package io.clype.streamload.model;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * One tick of the stats reporter.
 *
 * @param elapsed  time since the first recorded activity
 * @param snapshot counters at this tick
 * @param rate     messages per second since the previous tick; empty for the first tick
 */
public record StatsSample(
    Duration elapsed,
    MetricsSnapshot snapshot,
    OptionalDouble rate
) {

    public StatsSample {
        Objects.requireNonNull(elapsed, "elapsed cannot be null");
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        Objects.requireNonNull(rate, "rate cannot be null");
    }
}
