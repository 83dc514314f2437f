package io.clype.streamload.ratelimit;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class ConnectAttemptLimiterTest {

    private Scheduler blockingScheduler;

    @AfterEach
    void tearDown() {
        if (blockingScheduler != null) {
            blockingScheduler.dispose();
        }
    }

    @Test
    void disabledLimiterPassesThroughImmediately() {
        ConnectAttemptLimiter limiter = ConnectAttemptLimiter.disabled();

        assertFalse(limiter.isEnabled());

        long start = System.nanoTime();
        StepVerifier.create(Flux.range(0, 1000).concatMap(i -> limiter.acquirePermit()))
                .verifyComplete();
        long elapsed = System.nanoTime() - start;

        assertTrue(elapsed < Duration.ofMillis(500).toNanos(),
                "Disabled limiter should not block, took " + Duration.ofNanos(elapsed).toMillis() + "ms");
    }

    @Test
    void attemptRateIsEnforced() {
        blockingScheduler = Schedulers.newBoundedElastic(4, 100, "test-connect-limit");

        // 10 attempts per second
        ConnectAttemptLimiter limiter = new ConnectAttemptLimiter(10, Duration.ZERO, blockingScheduler);

        assertTrue(limiter.isEnabled());

        long start = System.nanoTime();
        List<Mono<Void>> attempts = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            attempts.add(limiter.acquirePermit());
        }

        StepVerifier.create(Flux.merge(attempts))
                .verifyComplete();

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        // At least the 5 attempts beyond one second of burst must wait
        assertTrue(elapsed.toMillis() >= 300,
                "Expected at least 300ms for 15 attempts at 10/sec, got " + elapsed.toMillis() + "ms");
    }

    @Test
    void warmupPeriodStillGrantsEveryPermit() {
        blockingScheduler = Schedulers.newBoundedElastic(4, 100, "test-connect-limit");

        ConnectAttemptLimiter limiter = new ConnectAttemptLimiter(100, Duration.ofSeconds(1), blockingScheduler);

        StepVerifier.create(Flux.range(0, 10).concatMap(i -> limiter.acquirePermit()))
                .verifyComplete();
    }

    @Test
    void onFailureHalvesRateDownToFloor() {
        blockingScheduler = Schedulers.newBoundedElastic(4, 100, "test-connect-limit");

        ConnectAttemptLimiter limiter = new ConnectAttemptLimiter(200, Duration.ZERO, blockingScheduler);

        assertEquals(1.0, limiter.getCurrentRateFactor(), 0.01);

        limiter.onFailure();
        assertEquals(0.5, limiter.getCurrentRateFactor(), 0.01);

        limiter.onFailure();
        assertEquals(0.25, limiter.getCurrentRateFactor(), 0.01);

        limiter.onFailure();
        assertEquals(0.125, limiter.getCurrentRateFactor(), 0.01);

        limiter.onFailure();
        assertEquals(0.1, limiter.getCurrentRateFactor(), 0.01);

        limiter.onFailure();
        assertEquals(0.1, limiter.getCurrentRateFactor(), 0.01);
    }

    @Test
    void consecutiveSuccessesRecoverRate() {
        blockingScheduler = Schedulers.newBoundedElastic(4, 100, "test-connect-limit");

        ConnectAttemptLimiter limiter = new ConnectAttemptLimiter(200, Duration.ZERO, blockingScheduler);

        limiter.onFailure();
        assertEquals(0.5, limiter.getCurrentRateFactor(), 0.01);

        for (int i = 0; i < 9; i++) {
            limiter.onSuccess();
        }
        assertEquals(0.5, limiter.getCurrentRateFactor(), 0.01);

        limiter.onSuccess();
        assertEquals(0.55, limiter.getCurrentRateFactor(), 0.01);

        for (int i = 0; i < 80; i++) {
            limiter.onSuccess();
        }
        assertEquals(1.0, limiter.getCurrentRateFactor(), 0.01);
    }

    @Test
    void failureResetsSuccessStreak() {
        blockingScheduler = Schedulers.newBoundedElastic(4, 100, "test-connect-limit");

        ConnectAttemptLimiter limiter = new ConnectAttemptLimiter(200, Duration.ZERO, blockingScheduler);

        limiter.onFailure();
        for (int i = 0; i < 9; i++) {
            limiter.onSuccess();
        }
        limiter.onFailure();
        limiter.onSuccess();

        assertEquals(0.25, limiter.getCurrentRateFactor(), 0.01);
    }

    @Test
    void disabledLimiterIgnoresFailureAndSuccess() {
        ConnectAttemptLimiter limiter = ConnectAttemptLimiter.disabled();

        limiter.onFailure();
        limiter.onSuccess();

        assertEquals(1.0, limiter.getCurrentRateFactor(), 0.01);
        limiter.destroy();
    }

    @Test
    void constructorRejectsInvalidArguments() {
        blockingScheduler = Schedulers.newBoundedElastic(4, 100, "test-connect-limit");

        assertThrows(IllegalArgumentException.class,
                () -> new ConnectAttemptLimiter(0, Duration.ZERO, blockingScheduler));
        assertThrows(IllegalArgumentException.class,
                () -> new ConnectAttemptLimiter(-5, Duration.ZERO, blockingScheduler));
        assertThrows(IllegalArgumentException.class,
                () -> new ConnectAttemptLimiter(10, null, blockingScheduler));
        assertThrows(IllegalArgumentException.class,
                () -> new ConnectAttemptLimiter(10, Duration.ZERO, null));
    }

    @Test
    void concurrentRateFactorUpdatesStayInBounds() throws InterruptedException {
        blockingScheduler = Schedulers.newBoundedElastic(4, 100, "test-connect-limit");
        ConnectAttemptLimiter limiter = new ConnectAttemptLimiter(1000, Duration.ZERO, blockingScheduler);

        int threadCount = 4;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        List<Throwable> errors = new ArrayList<>();

        for (int t = 0; t < threadCount; t++) {
            final boolean failing = t % 2 == 0;
            new Thread(() -> {
                try {
                    startLatch.await();
                    for (int i = 0; i < 100; i++) {
                        if (failing) {
                            limiter.onFailure();
                        } else {
                            limiter.onSuccess();
                        }
                        double factor = limiter.getCurrentRateFactor();
                        if (factor < 0.1 - 0.001 || factor > 1.0 + 0.001) {
                            throw new AssertionError("Rate factor out of bounds: " + factor);
                        }
                    }
                } catch (Throwable e) {
                    synchronized (errors) {
                        errors.add(e);
                    }
                } finally {
                    doneLatch.countDown();
                }
            }).start();
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS), "All threads should complete within timeout");
        assertTrue(errors.isEmpty(), "No errors should occur during concurrent updates: " + errors);
    }

    @Test
    void rateFactorUpdatesReturnPromptly() {
        blockingScheduler = Schedulers.newBoundedElastic(4, 100, "test-connect-limit");
        ConnectAttemptLimiter limiter = new ConnectAttemptLimiter(20, Duration.ZERO, blockingScheduler);

        assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
            for (int i = 0; i < 50; i++) {
                limiter.onFailure();
            }
            for (int i = 0; i < 500; i++) {
                limiter.onSuccess();
            }
        });

        assertEquals(1.0, limiter.getCurrentRateFactor(), 0.01);
    }
}
