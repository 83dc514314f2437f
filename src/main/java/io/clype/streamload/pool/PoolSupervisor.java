package io.clype.streamload.pool;

import java.io.PrintStream;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import io.clype.streamload.metrics.MetricsAggregator;
import io.clype.streamload.metrics.StreamLoadMetrics;
import io.clype.streamload.model.Endpoint;
import io.clype.streamload.model.MetricsSnapshot;
import io.clype.streamload.model.PoolConfig;
import io.clype.streamload.model.PoolState;
import io.clype.streamload.model.PoolSummary;
import io.clype.streamload.model.WorkerPhase;
import io.clype.streamload.ratelimit.ConnectAttemptLimiter;
import io.clype.streamload.report.StatsFormatter;
import io.clype.streamload.report.StatsReporter;
import io.clype.streamload.transport.StreamTransport;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Owns a pool of {@link ConnectionWorker}s against one endpoint.
 *
 * <p>Launches the configured number of workers with a fixed stagger delay between two
 * launches, runs a {@link StatsReporter} alongside them and drives a coordinated shutdown
 * when the operator interrupts.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * PoolSupervisor supervisor = new PoolSupervisor(
 *     PoolConfig.withWorkers(500),
 *     Endpoint.of("ws://localhost:8080/"),
 *     RoutingStreamTransport.createDefault(),
 *     new MetricsAggregator(),
 *     System.out);
 *
 * PoolSummary summary = supervisor.run(interruptSignal);   // blocks until interrupted
 * }</pre>
 *
 * <p><b>State machine:</b> {@code IDLE -> STARTING -> RUNNING -> STOPPING -> STOPPED}.
 * {@code RUNNING -> STOPPING} happens only through {@link #stop()}; {@code STOPPING -> STOPPED}
 * once every worker stopped or the grace period expired. Workers still running after the grace
 * period are abandoned, not cancelled, and reported as unaccounted.</p>
 *
 * <p><b>Thread Safety:</b> {@link #requestStop()} may be called from any thread, including a
 * JVM shutdown hook. {@link #start()} and {@link #stop()} are serialized; {@link #stop()} is
 * idempotent and returns the same summary on every call.</p>
 *
 * <p><b>Resource Management:</b> This class implements {@link DisposableBean} and disposes its
 * schedulers when the Spring context is destroyed.</p>
 */
public class PoolSupervisor implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(PoolSupervisor.class);

    /** A spawn progress line is printed every this many launched workers. */
    public static final int PROGRESS_INTERVAL = 50;

    private final PoolConfig config;
    private final Endpoint endpoint;
    private final StreamTransport transport;
    private final MetricsAggregator aggregator;
    private final StreamLoadMetrics metrics;
    private final ConnectAttemptLimiter limiter;
    private final Consumer<String> messageHandler;
    private final PrintStream out;
    private final Scheduler workerScheduler;
    private final Scheduler statsScheduler;
    private final StatsReporter reporter;

    private final ShutdownSignal shutdown = new ShutdownSignal();
    private final List<ConnectionWorker> workers = new CopyOnWriteArrayList<>();
    private final List<Disposable> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicReference<PoolState> state = new AtomicReference<>(PoolState.IDLE);
    private final Sinks.Many<PoolState> stateChanges = Sinks.many().replay().all();
    private final Object lifecycleLock = new Object();
    private PoolSummary summary;

    // ==========================================================================
    // Constructors
    // ==========================================================================

    /**
     * Creates a supervisor without Micrometer metrics, connect rate limiting or message handler.
     *
     * @param config     pool sizing and timing
     * @param endpoint   target endpoint
     * @param transport  transport used by every worker
     * @param aggregator shared counters
     * @param out        destination of progress, stats and summary lines
     */
    public PoolSupervisor(PoolConfig config, Endpoint endpoint, StreamTransport transport,
                          MetricsAggregator aggregator, PrintStream out) {
        this(config, endpoint, transport, aggregator, null, ConnectAttemptLimiter.disabled(),
                message -> { }, out);
    }

    /**
     * Creates a supervisor with its own worker and stats schedulers.
     *
     * @param config         pool sizing and timing
     * @param endpoint       target endpoint
     * @param transport      transport used by every worker
     * @param aggregator     shared counters
     * @param metrics        optional Micrometer metrics (may be null)
     * @param limiter        pool-wide connect attempt limiter (use ConnectAttemptLimiter.disabled() to disable)
     * @param messageHandler consumer of every received message
     * @param out            destination of progress, stats and summary lines
     */
    public PoolSupervisor(PoolConfig config, Endpoint endpoint, StreamTransport transport,
                          MetricsAggregator aggregator, StreamLoadMetrics metrics, ConnectAttemptLimiter limiter,
                          Consumer<String> messageHandler, PrintStream out) {
        this(config, endpoint, transport, aggregator, metrics, limiter, messageHandler, out,
                Schedulers.newParallel("streamload-worker"), Schedulers.newSingle("streamload-stats"));
    }

    /**
     * Creates a supervisor with explicit schedulers. Both schedulers are disposed by {@link #destroy()}.
     *
     * @param config          pool sizing and timing
     * @param endpoint        target endpoint
     * @param transport       transport used by every worker
     * @param aggregator      shared counters
     * @param metrics         optional Micrometer metrics (may be null)
     * @param limiter         pool-wide connect attempt limiter
     * @param messageHandler  consumer of every received message
     * @param out             destination of progress, stats and summary lines
     * @param workerScheduler scheduler running the workers, their timeouts and the launch stagger
     * @param statsScheduler  scheduler driving the stats ticks
     */
    public PoolSupervisor(PoolConfig config, Endpoint endpoint, StreamTransport transport,
                          MetricsAggregator aggregator, StreamLoadMetrics metrics, ConnectAttemptLimiter limiter,
                          Consumer<String> messageHandler, PrintStream out,
                          Scheduler workerScheduler, Scheduler statsScheduler) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint cannot be null");
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator cannot be null");
        this.metrics = metrics;
        this.limiter = Objects.requireNonNull(limiter, "limiter cannot be null");
        this.messageHandler = Objects.requireNonNull(messageHandler, "messageHandler cannot be null");
        this.out = Objects.requireNonNull(out, "out cannot be null");
        this.workerScheduler = Objects.requireNonNull(workerScheduler, "workerScheduler cannot be null");
        this.statsScheduler = Objects.requireNonNull(statsScheduler, "statsScheduler cannot be null");
        this.reporter = new StatsReporter(aggregator, config.statsInterval(), out, statsScheduler);
        stateChanges.tryEmitNext(PoolState.IDLE);
    }

    // ==========================================================================
    // Public API
    // ==========================================================================

    /**
     * Starts the pool, blocks until the interrupt source fires, then stops it.
     *
     * <p>The first signal of {@code interrupt} (value, completion or error) requests the stop.
     * An interrupt that arrives during startup cuts the launch sequence short.</p>
     *
     * @param interrupt the operator interrupt source
     * @return the final summary
     */
    public PoolSummary run(Publisher<?> interrupt) {
        Objects.requireNonNull(interrupt, "interrupt cannot be null");
        Disposable interruptSubscription = Flux.from(interrupt)
                .take(1)
                .subscribe(signal -> requestStop(),
                        error -> {
                            log.warn("Interrupt source failed, stopping pool: {}", error.toString());
                            requestStop();
                        },
                        this::requestStop);
        try {
            start();
            shutdown.asMono().block();
            return stop();
        } finally {
            interruptSubscription.dispose();
        }
    }

    /**
     * Launches the workers and the stats reporter, then moves to {@code RUNNING}.
     *
     * <p>Blocks the calling thread for the stagger delays only; returns once every worker was
     * launched or a stop was requested during startup.</p>
     *
     * @throws IllegalStateException if the pool was already started
     */
    public void start() {
        synchronized (lifecycleLock) {
            transition(PoolState.IDLE, PoolState.STARTING);
            int workerCount = config.workerCount();

            out.println("Starting stress test with " + workerCount + " clients");
            out.println("URL: " + endpoint.uri());
            out.println();

            reporter.start();

            // Launch k happens k * stagger after the first one, so scheduling overhead does not accumulate.
            Duration stagger = config.staggerDelay();
            Flux<Integer> launches = stagger.isZero()
                    ? Flux.range(0, workerCount)
                    : Flux.interval(Duration.ZERO, stagger, workerScheduler).take(workerCount).map(Long::intValue);
            launches
                    .takeUntilOther(shutdown.asMono())
                    .doOnNext(this::launch)
                    .blockLast();

            if (shutdown.isSignaled()) {
                log.info("Stop requested during startup after {} of {} workers", workers.size(), workerCount);
            } else {
                out.println();
                out.println("All " + workerCount + " clients spawned. Press Ctrl+C to stop.");
                out.println();
            }
            transition(PoolState.STARTING, PoolState.RUNNING);
        }
    }

    /**
     * Emits the shutdown signal without waiting for the workers. Safe from any thread; idempotent.
     */
    public void requestStop() {
        if (shutdown.signal()) {
            log.info("Shutdown requested for pool against {}", endpoint.uri());
        }
    }

    /**
     * Stops the pool: signals every worker, waits for them up to the grace period, stops the
     * reporter and prints the final summary.
     *
     * <p>Stopping a pool that was never started moves it straight to {@code STOPPED} with an
     * empty summary. A second call returns the first call's summary without printing again.</p>
     *
     * @return the final summary
     */
    public PoolSummary stop() {
        requestStop();
        synchronized (lifecycleLock) {
            if (summary != null) {
                return summary;
            }
            if (state.get() == PoolState.IDLE) {
                transition(PoolState.IDLE, PoolState.STOPPED);
                summary = new PoolSummary(aggregator.snapshot(), Duration.ZERO, 0, 0);
                return summary;
            }

            transition(PoolState.RUNNING, PoolState.STOPPING);
            out.println();
            out.println("Stopping...");

            int unaccounted = awaitWorkers();
            reporter.stop();

            MetricsSnapshot totals = aggregator.snapshot();
            summary = new PoolSummary(totals, totals.elapsedAt(aggregator.clock().instant()),
                    workers.size(), unaccounted);

            out.println();
            StatsFormatter.formatSummary(summary).forEach(out::println);
            out.flush();

            transition(PoolState.STOPPING, PoolState.STOPPED);
            return summary;
        }
    }

    /**
     * Returns the current pool state.
     *
     * @return the state
     */
    public PoolState getState() {
        return state.get();
    }

    /**
     * Returns every state the pool has entered, replayed from {@code IDLE} to late subscribers.
     *
     * @return the state changes
     */
    public Flux<PoolState> stateChanges() {
        return stateChanges.asFlux();
    }

    /**
     * Returns the workers launched so far, in launch order.
     *
     * @return an unmodifiable view of the workers
     */
    public List<ConnectionWorker> getWorkers() {
        return List.copyOf(workers);
    }

    /**
     * Returns the shared counters of this pool.
     *
     * @return the aggregator
     */
    public MetricsAggregator getAggregator() {
        return aggregator;
    }

    // ==========================================================================
    // Internals
    // ==========================================================================

    private void launch(int index) {
        ConnectionWorker worker = new ConnectionWorker(index, endpoint, config.reconnectBackoff(), transport,
                aggregator, metrics, limiter, shutdown, workerScheduler, messageHandler);
        workers.add(worker);
        subscriptions.add(worker.run()
                .subscribeOn(workerScheduler)
                .subscribe(null, error -> log.error("Worker {} terminated with an error", index, error)));

        int launched = index + 1;
        if (launched % PROGRESS_INTERVAL == 0) {
            out.println("Spawned " + launched + "/" + config.workerCount() + " clients...");
        }
    }

    /**
     * Waits for every worker to stop, bounded by the grace period.
     *
     * @return the number of workers that did not stop in time
     */
    private int awaitWorkers() {
        List<Mono<Void>> completions = workers.stream()
                .map(ConnectionWorker::stopped)
                .collect(Collectors.toList());

        Mono.when(completions)
                .timeout(config.shutdownGracePeriod(), workerScheduler)
                .onErrorResume(TimeoutException.class, e -> Mono.empty())
                .block();

        int unaccounted = (int) workers.stream()
                .filter(worker -> worker.getPhase() != WorkerPhase.STOPPED)
                .count();
        if (unaccounted > 0) {
            log.warn("{} of {} workers did not stop within the {}ms grace period and were abandoned",
                    unaccounted, workers.size(), config.shutdownGracePeriod().toMillis());
        }
        return unaccounted;
    }

    private void transition(PoolState from, PoolState to) {
        if (!state.compareAndSet(from, to)) {
            throw new IllegalStateException("Cannot move pool from " + from + " to " + to
                    + " (current state " + state.get() + ")");
        }
        stateChanges.tryEmitNext(to);
        log.debug("Pool state {} -> {}", from, to);
    }

    // ==========================================================================
    // Lifecycle
    // ==========================================================================

    /**
     * Signals shutdown, cancels any worker still running and disposes the schedulers when the
     * Spring context is destroyed.
     */
    @Override
    public void destroy() {
        requestStop();
        reporter.stop();
        subscriptions.forEach(Disposable::dispose);
        workerScheduler.dispose();
        statsScheduler.dispose();
    }
}
