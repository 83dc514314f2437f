package io.clype.streamload.model;

import java.time.Duration;

/**
 * Cumulative result of a pool run, printed once on shutdown.
 *
 * @param totals              counters after all workers stopped or were abandoned
 * @param elapsed             time since the first recorded activity
 * @param workersLaunched     workers actually started (less than configured if stopped during startup)
 * @param unaccountedWorkers  workers still running when the grace period expired
 */
public record PoolSummary(
    MetricsSnapshot totals,
    Duration elapsed,
    int workersLaunched,
    int unaccountedWorkers
) {}
