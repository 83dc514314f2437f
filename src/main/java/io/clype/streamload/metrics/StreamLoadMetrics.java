package io.clype.streamload.metrics;

import java.util.concurrent.TimeUnit;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Publishes load-harness statistics to a Micrometer registry.
 *
 * <p><b>Available Metrics:</b></p>
 * <ul>
 *   <li>{@code streamload.connections.opened} - Counter of connections that reached the connected phase</li>
 *   <li>{@code streamload.connections.closed} - Counter of established connections that ended</li>
 *   <li>{@code streamload.errors} - Counter of failed attempts and abnormal closures</li>
 *   <li>{@code streamload.messages.received} - Counter of received messages</li>
 *   <li>{@code streamload.connections.open} - Gauge of currently open connections</li>
 *   <li>{@code streamload.connect.latency} - Timer of successful connection establishment (p50, p95, p99)</li>
 *   <li>{@code streamload.message.size} - Summary of message sizes in characters</li>
 * </ul>
 *
 * <p>The four counters read straight from the {@link MetricsAggregator}, so they
 * always agree with the printed stats. All metrics are tagged with the endpoint host.</p>
 */
public class StreamLoadMetrics {

    private static final String METRIC_PREFIX = "streamload";
    private static final double[] CONNECT_LATENCY_PERCENTILES = {0.5, 0.95, 0.99};

    private final Timer connectLatency;
    private final DistributionSummary messageSize;

    /**
     * Creates a new StreamLoadMetrics instance.
     *
     * @param registry   the Micrometer registry to register metrics with
     * @param aggregator the aggregator backing the counters
     * @param host       endpoint host used for tagging (null or empty becomes "unknown")
     */
    public StreamLoadMetrics(MeterRegistry registry, MetricsAggregator aggregator, String host) {
        Tags tags = Tags.of("endpoint", host == null || host.isEmpty() ? "unknown" : host);

        FunctionCounter.builder(METRIC_PREFIX + ".connections.opened", aggregator,
                        a -> a.snapshot().connectedTotal())
                .description("Number of connections that reached the connected phase")
                .tags(tags)
                .register(registry);

        FunctionCounter.builder(METRIC_PREFIX + ".connections.closed", aggregator,
                        a -> a.snapshot().disconnectedTotal())
                .description("Number of established connections that ended")
                .tags(tags)
                .register(registry);

        FunctionCounter.builder(METRIC_PREFIX + ".errors", aggregator,
                        a -> a.snapshot().errorTotal())
                .description("Number of failed connection attempts and abnormal closures")
                .tags(tags)
                .register(registry);

        FunctionCounter.builder(METRIC_PREFIX + ".messages.received", aggregator,
                        a -> a.snapshot().messageTotal())
                .description("Total number of messages received across all connections")
                .tags(tags)
                .register(registry);

        Gauge.builder(METRIC_PREFIX + ".connections.open", aggregator,
                        a -> a.snapshot().openConnections())
                .description("Number of currently open connections")
                .tags(tags)
                .register(registry);

        this.connectLatency = Timer.builder(METRIC_PREFIX + ".connect.latency")
                .description("Time taken to establish a stream connection")
                .tags(tags)
                .publishPercentiles(CONNECT_LATENCY_PERCENTILES)
                .register(registry);

        this.messageSize = DistributionSummary.builder(METRIC_PREFIX + ".message.size")
                .description("Size of received messages in characters")
                .baseUnit("chars")
                .tags(tags)
                .register(registry);
    }

    /**
     * Records the time a successful connection attempt took.
     *
     * @param latencyNanos elapsed time in nanoseconds
     */
    public void recordConnectLatency(long latencyNanos) {
        connectLatency.record(latencyNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Records the size of a received message.
     *
     * @param length message length in characters
     */
    public void recordMessageSize(int length) {
        messageSize.record(length);
    }
}
