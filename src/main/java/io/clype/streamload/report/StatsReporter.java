package io.clype.streamload.report;

import java.io.PrintStream;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.streamload.metrics.MetricsAggregator;
import io.clype.streamload.model.StatsSample;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

/**
 * Prints a stats line every interval while a pool runs.
 *
 * <p>Ticks before the first recorded activity are sampled (they seed the rate baseline)
 * but not printed. The reporter only reads snapshots, so it never blocks workers, and a
 * failing print is logged and skipped rather than ending the reporting stream.</p>
 */
public class StatsReporter {

    private static final Logger log = LoggerFactory.getLogger(StatsReporter.class);

    private final MetricsAggregator aggregator;
    private final Duration interval;
    private final PrintStream out;
    private final Scheduler scheduler;
    private Disposable subscription;

    /**
     * Creates a reporter.
     *
     * @param aggregator source of the snapshots
     * @param interval   time between two ticks
     * @param out        destination of the stats lines
     * @param scheduler  scheduler driving the ticks
     */
    public StatsReporter(MetricsAggregator aggregator, Duration interval, PrintStream out, Scheduler scheduler) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator cannot be null");
        this.interval = Objects.requireNonNull(interval, "interval cannot be null");
        this.out = Objects.requireNonNull(out, "out cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
    }

    /**
     * Returns the stream of printable samples, one per tick once activity started.
     *
     * <p>Each subscription samples independently with its own rate baseline.</p>
     *
     * @return the samples
     */
    public Flux<StatsSample> samples() {
        return Flux.defer(() -> {
            StatsSampler sampler = new StatsSampler(interval);
            return Flux.interval(interval, scheduler)
                    .onBackpressureDrop()
                    .map(tick -> sampler.sample(tick, aggregator.snapshot(), now()))
                    .filter(sample -> sample.snapshot().hasActivity());
        });
    }

    /**
     * Starts printing. Calling it again while running has no effect.
     */
    public synchronized void start() {
        if (subscription == null || subscription.isDisposed()) {
            subscription = samples().subscribe(this::print,
                    error -> log.error("Stats reporting stopped unexpectedly", error));
        }
    }

    /**
     * Stops printing. Idempotent.
     */
    public synchronized void stop() {
        if (subscription != null) {
            subscription.dispose();
        }
    }

    void print(StatsSample sample) {
        try {
            out.println(StatsFormatter.formatLine(sample));
            if (out.checkError()) {
                log.warn("Stats output reported an error; continuing");
            }
        } catch (RuntimeException e) {
            log.warn("Failed to print stats line: {}", e.toString());
        }
    }

    private Instant now() {
        return aggregator.clock().instant();
    }
}
