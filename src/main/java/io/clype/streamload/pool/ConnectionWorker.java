package io.clype.streamload.pool;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.streamload.metrics.MetricsAggregator;
import io.clype.streamload.metrics.StreamLoadMetrics;
import io.clype.streamload.model.ConnectionFailureException;
import io.clype.streamload.model.ConnectionFailureException.Stage;
import io.clype.streamload.model.Endpoint;
import io.clype.streamload.model.WorkerPhase;
import io.clype.streamload.ratelimit.ConnectAttemptLimiter;
import io.clype.streamload.transport.StreamConnection;
import io.clype.streamload.transport.StreamTransport;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

/**
 * One simulated client: keeps a single connection slot open against the endpoint until
 * the pool shuts down.
 *
 * <p>Each session walks {@code CONNECTING -> CONNECTED -> DISCONNECTED}; between sessions the
 * worker waits the reconnect backoff. The worker always makes at least one attempt, even if
 * shutdown was signaled before it started, and returns to {@code STOPPED} once it sees the
 * shutdown signal at a safe point: between two messages, after a failed attempt, or during
 * the backoff.</p>
 *
 * <p><b>Accounting:</b></p>
 * <ul>
 *   <li>attempt fails before connecting: {@code error_total += 1} only</li>
 *   <li>connection established: {@code connected_total += 1}</li>
 *   <li>established connection ends cleanly (end of stream, close 1000, shutdown):
 *       {@code disconnected_total += 1}</li>
 *   <li>established connection drops (transport error, idle timeout, abnormal close):
 *       {@code disconnected_total += 1} and {@code error_total += 1}</li>
 *   <li>every received message: {@code message_total += 1}</li>
 * </ul>
 *
 * <p>The phase is written only by this worker's own pipeline and read by the supervisor.</p>
 */
public class ConnectionWorker {

    private static final Logger log = LoggerFactory.getLogger(ConnectionWorker.class);

    private final int id;
    private final Endpoint endpoint;
    private final Duration reconnectBackoff;
    private final StreamTransport transport;
    private final MetricsAggregator aggregator;
    private final StreamLoadMetrics metrics;
    private final ConnectAttemptLimiter limiter;
    private final ShutdownSignal shutdown;
    private final Scheduler scheduler;
    private final Consumer<String> messageHandler;
    private final long launchNanos;
    private final Sinks.Empty<Void> stopped = Sinks.empty();

    private volatile WorkerPhase phase = WorkerPhase.CONNECTING;
    private volatile boolean attempted;

    /**
     * Creates a worker.
     *
     * @param id               worker index, used in log lines
     * @param endpoint         target endpoint
     * @param reconnectBackoff minimum pause between two attempts
     * @param transport        transport used to connect
     * @param aggregator       shared counters
     * @param metrics          optional Micrometer metrics (may be null)
     * @param limiter          pool-wide connect attempt limiter
     * @param shutdown         shared shutdown signal
     * @param scheduler        scheduler for timeouts and backoff delays
     * @param messageHandler   consumer of every received message; its failures are logged and ignored
     */
    public ConnectionWorker(int id, Endpoint endpoint, Duration reconnectBackoff, StreamTransport transport,
                            MetricsAggregator aggregator, StreamLoadMetrics metrics, ConnectAttemptLimiter limiter,
                            ShutdownSignal shutdown, Scheduler scheduler, Consumer<String> messageHandler) {
        this.id = id;
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint cannot be null");
        this.reconnectBackoff = Objects.requireNonNull(reconnectBackoff, "reconnectBackoff cannot be null");
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator cannot be null");
        this.metrics = metrics;
        this.limiter = Objects.requireNonNull(limiter, "limiter cannot be null");
        this.shutdown = Objects.requireNonNull(shutdown, "shutdown cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.messageHandler = Objects.requireNonNull(messageHandler, "messageHandler cannot be null");
        this.launchNanos = System.nanoTime();
    }

    // ==========================================================================
    // Lifecycle
    // ==========================================================================

    /**
     * Runs the connect/consume/backoff loop until the shutdown signal is observed.
     *
     * <p>The returned Mono never errors: every connection failure is absorbed into the
     * counters. It completes once the worker is {@code STOPPED}.</p>
     *
     * @return a Mono completing when the worker stops
     */
    public Mono<Void> run() {
        return Mono.defer(this::runSession)
                .then(Mono.defer(this::backoff))
                .repeat(() -> !shutdown.isSignaled())
                .then()
                .doFinally(signal -> {
                    phase = WorkerPhase.STOPPED;
                    stopped.tryEmitEmpty();
                    log.debug("Worker {} stopped ({})", id, signal);
                });
    }

    /**
     * Returns a Mono completing once this worker reached {@code STOPPED}.
     *
     * @return the stop notification
     */
    public Mono<Void> stopped() {
        return stopped.asMono();
    }

    public WorkerPhase getPhase() {
        return phase;
    }

    public int getId() {
        return id;
    }

    /**
     * Returns the {@link System#nanoTime()} at which the worker was created by its supervisor.
     *
     * @return launch timestamp in nanoseconds
     */
    public long getLaunchNanos() {
        return launchNanos;
    }

    // ==========================================================================
    // Session (one connect + consume cycle)
    // ==========================================================================

    private Mono<Void> runSession() {
        if (attempted && shutdown.isSignaled()) {
            return Mono.empty();
        }
        phase = WorkerPhase.CONNECTING;
        return awaitPermit()
                .flatMap(granted -> granted || !attempted ? connect() : Mono.<StreamConnection>empty())
                .flatMap(connection -> Mono.using(() -> connection, this::consume, StreamConnection::close));
    }

    /**
     * Waits for a limiter permit or the shutdown signal, whichever comes first.
     *
     * @return true if the permit was granted, false if shutdown won the race
     */
    private Mono<Boolean> awaitPermit() {
        return limiter.acquirePermit()
                .thenReturn(Boolean.TRUE)
                .or(shutdown.asMono().map(signaled -> Boolean.FALSE));
    }

    private Mono<StreamConnection> connect() {
        attempted = true;
        long startNanos = System.nanoTime();
        return transport.connect(endpoint)
                .timeout(endpoint.connectTimeout(), scheduler)
                .onErrorMap(TimeoutException.class, e -> new ConnectionFailureException(Stage.ESTABLISH,
                        endpoint.uri(), "connect timed out after " + endpoint.connectTimeout().toMillis() + "ms", e))
                .doOnNext(connection -> onConnected(System.nanoTime() - startNanos))
                .onErrorResume(e -> {
                    onConnectFailure(e);
                    return Mono.empty();
                });
    }

    private Mono<Void> consume(StreamConnection connection) {
        return connection.messages()
                .timeout(endpoint.idleTimeout(), scheduler)
                .takeUntilOther(shutdown.asMono())
                .doOnNext(this::onMessage)
                .then()
                .doOnSuccess(ignored -> onDisconnected(null))
                .onErrorResume(e -> {
                    onDisconnected(e);
                    return Mono.empty();
                })
                .doOnCancel(() -> onDisconnected(null));
    }

    private Mono<Void> backoff() {
        if (shutdown.isSignaled()) {
            return Mono.empty();
        }
        return Mono.delay(reconnectBackoff, scheduler)
                .then()
                .or(shutdown.asMono().then());
    }

    // ==========================================================================
    // Lifecycle events
    // ==========================================================================

    private void onConnected(long latencyNanos) {
        phase = WorkerPhase.CONNECTED;
        aggregator.recordConnected();
        limiter.onSuccess();
        if (metrics != null) {
            metrics.recordConnectLatency(latencyNanos);
        }
        log.debug("Worker {} connected to {}", id, endpoint.uri());
    }

    private void onConnectFailure(Throwable error) {
        phase = WorkerPhase.DISCONNECTED;
        aggregator.recordConnectFailure();
        limiter.onFailure();
        log.debug("Worker {} failed to connect: {}", id, error.getMessage());
    }

    private void onMessage(String message) {
        aggregator.recordMessage();
        if (metrics != null) {
            metrics.recordMessageSize(message.length());
        }
        try {
            messageHandler.accept(message);
        } catch (RuntimeException e) {
            log.debug("Worker {} message handler failed: {}", id, e.toString());
        }
    }

    private void onDisconnected(Throwable error) {
        phase = WorkerPhase.DISCONNECTED;
        aggregator.recordDisconnected(error != null);
        if (error == null) {
            log.debug("Worker {} disconnected", id);
        } else {
            log.debug("Worker {} connection dropped: {}", id, describe(error));
        }
    }

    private static String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "idle timeout";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
