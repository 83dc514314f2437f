package io.clype.streamload.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing and timing of a worker pool. Validated once, read-only thereafter.
 *
 * @param workerCount         number of concurrent connection slots (0 allowed)
 * @param staggerDelay        pause between two successive worker launches
 * @param statsInterval       period of the stats line
 * @param reconnectBackoff    minimum pause between two connection attempts of one worker
 * @param shutdownGracePeriod maximum wait for workers to stop before they are abandoned
 */
public record PoolConfig(
    int workerCount,
    Duration staggerDelay,
    Duration statsInterval,
    Duration reconnectBackoff,
    Duration shutdownGracePeriod
) {

    public static final int DEFAULT_WORKER_COUNT = 500;
    public static final Duration DEFAULT_STAGGER_DELAY = Duration.ofMillis(20);
    public static final Duration DEFAULT_STATS_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_RECONNECT_BACKOFF = Duration.ofSeconds(1);
    public static final Duration DEFAULT_SHUTDOWN_GRACE_PERIOD = Duration.ofSeconds(10);

    /** Upper bound on workers; each one holds a socket. */
    public static final int MAX_WORKER_COUNT = 100_000;

    /**
     * Creates a validated pool configuration.
     *
     * @throws NullPointerException     if any duration is null
     * @throws IllegalArgumentException if workerCount is negative or above {@link #MAX_WORKER_COUNT},
     *                                  staggerDelay is negative, or any other duration is not positive
     */
    public PoolConfig {
        Objects.requireNonNull(staggerDelay, "staggerDelay cannot be null");
        Objects.requireNonNull(statsInterval, "statsInterval cannot be null");
        Objects.requireNonNull(reconnectBackoff, "reconnectBackoff cannot be null");
        Objects.requireNonNull(shutdownGracePeriod, "shutdownGracePeriod cannot be null");

        if (workerCount < 0) {
            throw new IllegalArgumentException("workerCount must not be negative");
        }
        if (workerCount > MAX_WORKER_COUNT) {
            throw new IllegalArgumentException("workerCount must not exceed " + MAX_WORKER_COUNT);
        }
        if (staggerDelay.isNegative()) {
            throw new IllegalArgumentException("staggerDelay must not be negative");
        }
        requirePositive(statsInterval, "statsInterval");
        requirePositive(reconnectBackoff, "reconnectBackoff");
        requirePositive(shutdownGracePeriod, "shutdownGracePeriod");
    }

    /**
     * Creates a configuration with default timings.
     *
     * @param workerCount number of workers
     * @return the configuration
     */
    public static PoolConfig withWorkers(int workerCount) {
        return new PoolConfig(workerCount, DEFAULT_STAGGER_DELAY, DEFAULT_STATS_INTERVAL,
                DEFAULT_RECONNECT_BACKOFF, DEFAULT_SHUTDOWN_GRACE_PERIOD);
    }

    private static void requirePositive(Duration value, String name) {
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
