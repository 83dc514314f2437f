package io.clype.streamload.pool;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.clype.streamload.metrics.MetricsAggregator;
import io.clype.streamload.model.ConnectionFailureException;
import io.clype.streamload.model.ConnectionFailureException.Stage;
import io.clype.streamload.model.Endpoint;
import io.clype.streamload.model.MetricsSnapshot;
import io.clype.streamload.model.WorkerPhase;
import io.clype.streamload.ratelimit.ConnectAttemptLimiter;
import io.clype.streamload.transport.StreamTransport;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import static io.clype.streamload.pool.Conditions.awaitTrue;
import static org.junit.jupiter.api.Assertions.*;

class ConnectionWorkerTest {

    private static final URI URI_WS = URI.create("ws://localhost:8080/");
    private static final Duration WAIT = Duration.ofSeconds(5);

    private Scheduler scheduler;
    private MetricsAggregator aggregator;
    private ShutdownSignal shutdown;
    private Disposable running;

    @BeforeEach
    void setUp() {
        scheduler = Schedulers.newParallel("test-worker", 2);
        aggregator = new MetricsAggregator();
        shutdown = new ShutdownSignal();
    }

    @AfterEach
    void tearDown() {
        shutdown.signal();
        if (running != null) {
            running.dispose();
        }
        scheduler.dispose();
    }

    private ConnectionWorker worker(Endpoint endpoint, Duration backoff, StreamTransport transport) {
        return new ConnectionWorker(0, endpoint, backoff, transport, aggregator, null,
                ConnectAttemptLimiter.disabled(), shutdown, scheduler, message -> { });
    }

    private static Endpoint endpoint(Duration connectTimeout, Duration idleTimeout) {
        return new Endpoint(URI_WS, connectTimeout, idleTimeout, Map.of());
    }

    private void stopAndAwait(ConnectionWorker worker) {
        shutdown.signal();
        worker.stopped().block(WAIT);
        assertEquals(WorkerPhase.STOPPED, worker.getPhase());
    }

    @Test
    void reconnectsAfterCleanEndOfStream() {
        StreamTransport transport = endpoint -> Mono.just(new FakeConnection(Flux.just("a", "b")));
        ConnectionWorker worker = worker(Endpoint.of("ws://localhost:8080/"), Duration.ofMillis(10), transport);

        running = worker.run().subscribe();
        awaitTrue(() -> aggregator.snapshot().connectedTotal() >= 3, WAIT, "three sessions");
        stopAndAwait(worker);

        MetricsSnapshot snapshot = aggregator.snapshot();
        assertEquals(snapshot.connectedTotal(), snapshot.disconnectedTotal());
        assertEquals(0, snapshot.errorTotal());
        assertTrue(snapshot.messageTotal() >= 6, "two messages per session, got " + snapshot.messageTotal());
    }

    @Test
    void connectFailuresCountAsErrorsOnly() {
        AtomicInteger attempts = new AtomicInteger();
        StreamTransport transport = endpoint -> Mono.error(
                new ConnectionFailureException(Stage.ESTABLISH, endpoint.uri(), "connection refused"));
        StreamTransport counting = endpoint -> {
            attempts.incrementAndGet();
            return transport.connect(endpoint);
        };
        ConnectionWorker worker = worker(Endpoint.of("ws://localhost:8080/"), Duration.ofMillis(10), counting);

        running = worker.run().subscribe();
        awaitTrue(() -> attempts.get() >= 3, WAIT, "three attempts");
        stopAndAwait(worker);

        MetricsSnapshot snapshot = aggregator.snapshot();
        assertEquals(0, snapshot.connectedTotal());
        assertEquals(0, snapshot.disconnectedTotal());
        assertEquals(attempts.get(), snapshot.errorTotal());
    }

    @Test
    void neverRetriesFasterThanBackoff() {
        Duration backoff = Duration.ofMillis(100);
        List<Long> attemptNanos = new CopyOnWriteArrayList<>();
        StreamTransport transport = endpoint -> Mono.defer(() -> {
            attemptNanos.add(System.nanoTime());
            return Mono.error(new ConnectionFailureException(Stage.ESTABLISH, endpoint.uri(), "refused"));
        });
        ConnectionWorker worker = worker(Endpoint.of("ws://localhost:8080/"), backoff, transport);

        running = worker.run().subscribe();
        awaitTrue(() -> attemptNanos.size() >= 4, WAIT, "four attempts");
        stopAndAwait(worker);

        for (int i = 1; i < attemptNanos.size(); i++) {
            long gapMillis = Duration.ofNanos(attemptNanos.get(i) - attemptNanos.get(i - 1)).toMillis();
            assertTrue(gapMillis >= backoff.toMillis() - 5,
                    "Attempts " + (i - 1) + " and " + i + " only " + gapMillis + "ms apart");
        }
    }

    @Test
    void attemptsOnceEvenWhenShutdownAlreadySignaled() {
        AtomicInteger attempts = new AtomicInteger();
        StreamTransport transport = endpoint -> Mono.fromSupplier(() -> {
            attempts.incrementAndGet();
            return new FakeConnection(Flux.never());
        });
        ConnectionWorker worker = worker(Endpoint.of("ws://localhost:8080/"), Duration.ofMillis(10), transport);

        shutdown.signal();
        worker.run().block(WAIT);

        assertEquals(1, attempts.get());
        assertEquals(WorkerPhase.STOPPED, worker.getPhase());
        assertEquals(aggregator.snapshot().connectedTotal(), aggregator.snapshot().disconnectedTotal());
    }

    @Test
    void shutdownClosesOpenConnectionCleanly() {
        FakeConnection connection = FakeConnection.silent();
        ConnectionWorker worker = worker(Endpoint.of("ws://localhost:8080/"), Duration.ofMillis(10),
                endpoint -> Mono.just(connection));

        running = worker.run().subscribe();
        awaitTrue(() -> worker.getPhase() == WorkerPhase.CONNECTED, WAIT, "connected");
        stopAndAwait(worker);

        MetricsSnapshot snapshot = aggregator.snapshot();
        assertEquals(1, snapshot.connectedTotal());
        assertEquals(1, snapshot.disconnectedTotal());
        assertEquals(0, snapshot.errorTotal());
        assertTrue(connection.isClosed());
    }

    @Test
    void idleTimeoutIsAnAbnormalClosure() {
        ConnectionWorker worker = worker(endpoint(Duration.ofSeconds(5), Duration.ofMillis(50)),
                Duration.ofMillis(10), endpoint -> Mono.just(FakeConnection.silent()));

        running = worker.run().subscribe();
        awaitTrue(() -> aggregator.snapshot().errorTotal() >= 1, WAIT, "idle timeout");
        stopAndAwait(worker);

        MetricsSnapshot snapshot = aggregator.snapshot();
        assertEquals(snapshot.connectedTotal(), snapshot.disconnectedTotal());
        assertTrue(snapshot.errorTotal() >= 1);
    }

    @Test
    void receiveFailureIsAnAbnormalClosure() {
        StreamTransport transport = endpoint -> Mono.just(new FakeConnection(Flux.concat(
                Flux.just("x"),
                Flux.error(new ConnectionFailureException(Stage.RECEIVE, endpoint.uri(), "reset")))));
        ConnectionWorker worker = worker(Endpoint.of("ws://localhost:8080/"), Duration.ofSeconds(10), transport);

        running = worker.run().subscribe();
        awaitTrue(() -> aggregator.snapshot().disconnectedTotal() >= 1, WAIT, "dropped connection");
        stopAndAwait(worker);

        MetricsSnapshot snapshot = aggregator.snapshot();
        assertEquals(1, snapshot.connectedTotal());
        assertEquals(1, snapshot.disconnectedTotal());
        assertEquals(1, snapshot.errorTotal());
        assertEquals(1, snapshot.messageTotal());
    }

    @Test
    void connectTimeoutCountsAsError() {
        ConnectionWorker worker = worker(endpoint(Duration.ofMillis(50), Duration.ofSeconds(5)),
                Duration.ofMillis(10), endpoint -> Mono.never());

        running = worker.run().subscribe();
        awaitTrue(() -> aggregator.snapshot().errorTotal() >= 1, WAIT, "connect timeout");
        shutdown.signal();
        worker.stopped().block(WAIT);

        assertEquals(0, aggregator.snapshot().connectedTotal());
        assertEquals(0, aggregator.snapshot().disconnectedTotal());
    }

    @Test
    void failingMessageHandlerDoesNotStopReceiving() {
        AtomicInteger handled = new AtomicInteger();
        ConnectionWorker worker = new ConnectionWorker(7, Endpoint.of("ws://localhost:8080/"), Duration.ofSeconds(10),
                endpoint -> Mono.just(new FakeConnection(Flux.concat(Flux.just("1", "2", "3"), Flux.never()))),
                aggregator, null, ConnectAttemptLimiter.disabled(), shutdown, scheduler,
                message -> {
                    handled.incrementAndGet();
                    throw new IllegalArgumentException("cannot decode " + message);
                });

        running = worker.run().subscribe();
        awaitTrue(() -> aggregator.snapshot().messageTotal() == 3, WAIT, "three messages");
        stopAndAwait(worker);

        assertEquals(3, handled.get());
        assertEquals(1, aggregator.snapshot().connectedTotal());
        assertEquals(0, aggregator.snapshot().errorTotal());
        assertEquals(7, worker.getId());
    }

    @Test
    void shutdownReleasesWorkerQueuedForConnectPermit() {
        Scheduler limiterScheduler = Schedulers.newBoundedElastic(2, 100, "test-connect-limit");
        // One attempt per second: the first permit is immediate, the next one waits
        ConnectAttemptLimiter limiter = new ConnectAttemptLimiter(1, Duration.ZERO, limiterScheduler);
        AtomicInteger attempts = new AtomicInteger();
        StreamTransport transport = endpoint -> Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(new ConnectionFailureException(Stage.ESTABLISH, endpoint.uri(), "refused"));
        });
        ConnectionWorker worker = new ConnectionWorker(0, Endpoint.of("ws://localhost:8080/"), Duration.ofMillis(10),
                transport, aggregator, null, limiter, shutdown, scheduler, message -> { });

        try {
            running = worker.run().subscribe();
            awaitTrue(() -> attempts.get() == 1 && worker.getPhase() == WorkerPhase.CONNECTING, WAIT,
                    "worker queued for its second permit");

            long start = System.nanoTime();
            shutdown.signal();
            worker.stopped().block(WAIT);
            long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

            assertEquals(WorkerPhase.STOPPED, worker.getPhase());
            assertTrue(elapsedMillis < 500, "Queued worker took " + elapsedMillis + "ms to stop");
            assertEquals(1, attempts.get(), "No attempt may start after shutdown");
            assertEquals(1, aggregator.snapshot().errorTotal());
        } finally {
            limiter.destroy();
        }
    }

    @Test
    void firstAttemptSkipsPermitQueueOnceShutdownSignaled() {
        Scheduler limiterScheduler = Schedulers.newBoundedElastic(2, 100, "test-connect-limit");
        ConnectAttemptLimiter limiter = new ConnectAttemptLimiter(1, Duration.ZERO, limiterScheduler);
        AtomicInteger attempts = new AtomicInteger();
        StreamTransport transport = endpoint -> Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(new ConnectionFailureException(Stage.ESTABLISH, endpoint.uri(), "refused"));
        });
        ConnectionWorker worker = new ConnectionWorker(0, Endpoint.of("ws://localhost:8080/"), Duration.ofMillis(10),
                transport, aggregator, null, limiter, shutdown, scheduler, message -> { });

        try {
            shutdown.signal();
            worker.run().block(WAIT);

            assertEquals(1, attempts.get());
            assertEquals(WorkerPhase.STOPPED, worker.getPhase());
        } finally {
            limiter.destroy();
        }
    }
}
