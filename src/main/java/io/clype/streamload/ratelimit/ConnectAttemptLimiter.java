package io.clype.streamload.ratelimit;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import com.google.common.util.concurrent.RateLimiter;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Adaptive token bucket bounding the pool-wide rate of connection attempts.
 *
 * <p>Every worker acquires one permit before each connection attempt. When many
 * workers lose their connection at once (target restart, network blip) they would
 * otherwise all reconnect at the end of the same backoff window; the limiter spreads
 * those attempts out.</p>
 *
 * <p><b>Adaptive Behavior:</b> {@link #onFailure()} halves the rate (minimum 10% of the
 * configured rate). After 10 consecutive {@link #onSuccess()} calls the rate grows by 10%
 * until it is back at the configured value.</p>
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. The underlying Guava RateLimiter is
 * thread-safe and the rate factor is updated with compare-and-set loops over its raw
 * {@code long} bits, so the comparison is by value rather than by boxed identity.</p>
 */
public class ConnectAttemptLimiter implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ConnectAttemptLimiter.class);

    private static final double MIN_RATE_FACTOR = 0.1;  // Don't go below 10% of configured rate
    private static final double FAILURE_REDUCTION_FACTOR = 0.5;
    private static final double RECOVERY_INCREASE_FACTOR = 1.1;
    private static final int SUCCESSES_BEFORE_RECOVERY = 10;

    private final RateLimiter rateLimiter;
    private final int attemptsPerSecond;
    private final Scheduler blockingScheduler;
    private final boolean enabled;
    private final AtomicInteger consecutiveSuccesses = new AtomicInteger(0);
    private final AtomicLong currentRateFactorBits = new AtomicLong(Double.doubleToLongBits(1.0));

    /**
     * Creates a disabled limiter that lets every attempt through immediately.
     *
     * @return a no-op limiter
     */
    public static ConnectAttemptLimiter disabled() {
        return new ConnectAttemptLimiter(false, 0, Duration.ZERO, null);
    }

    /**
     * Creates an enabled limiter.
     *
     * @param attemptsPerSecond pool-wide connection attempts per second
     * @param warmupPeriod      period to ramp up to the full rate (zero for instant)
     * @param blockingScheduler scheduler for the blocking acquire calls
     */
    public ConnectAttemptLimiter(int attemptsPerSecond, Duration warmupPeriod, Scheduler blockingScheduler) {
        this(true, attemptsPerSecond, warmupPeriod, blockingScheduler);
    }

    private ConnectAttemptLimiter(boolean enabled, int attemptsPerSecond, Duration warmupPeriod,
                                  Scheduler blockingScheduler) {
        this.enabled = enabled;
        this.attemptsPerSecond = attemptsPerSecond;
        this.blockingScheduler = blockingScheduler;

        if (enabled) {
            if (attemptsPerSecond <= 0) {
                throw new IllegalArgumentException("attemptsPerSecond must be positive, got: " + attemptsPerSecond);
            }
            if (warmupPeriod == null) {
                throw new IllegalArgumentException("warmupPeriod cannot be null");
            }
            if (blockingScheduler == null) {
                throw new IllegalArgumentException("blockingScheduler cannot be null when rate limiting is enabled");
            }
            this.rateLimiter = warmupPeriod.isZero()
                    ? RateLimiter.create(attemptsPerSecond)
                    : RateLimiter.create(attemptsPerSecond, warmupPeriod.toMillis(), TimeUnit.MILLISECONDS);
        } else {
            this.rateLimiter = null;
        }
    }

    /**
     * Acquires the permit for one connection attempt.
     *
     * @return a Mono that completes once the attempt may proceed; completes immediately when disabled
     */
    public Mono<Void> acquirePermit() {
        if (!enabled) {
            return Mono.empty();
        }
        return Mono.fromRunnable(rateLimiter::acquire)
                .subscribeOn(blockingScheduler)
                .then();
    }

    /**
     * Called when a connection attempt failed. Halves the rate down to the 10% floor.
     */
    public void onFailure() {
        if (!enabled) {
            return;
        }

        consecutiveSuccesses.set(0);

        long oldBits;
        double oldFactor;
        double newFactor;
        do {
            oldBits = currentRateFactorBits.get();
            oldFactor = Double.longBitsToDouble(oldBits);
            newFactor = Math.max(oldFactor * FAILURE_REDUCTION_FACTOR, MIN_RATE_FACTOR);
            if (newFactor >= oldFactor) {
                break;
            }
        } while (!currentRateFactorBits.compareAndSet(oldBits, Double.doubleToLongBits(newFactor)));

        if (newFactor < oldFactor) {
            double newRate = attemptsPerSecond * newFactor;
            rateLimiter.setRate(newRate);
            log.warn("Connection failures detected - reducing attempt rate to {}/sec ({}% of configured)",
                    Math.round(newRate * 10) / 10.0, Math.round(newFactor * 100));
        }
    }

    /**
     * Called when a connection attempt succeeded. Recovers the rate after enough consecutive successes.
     */
    public void onSuccess() {
        if (!enabled || getCurrentRateFactor() >= 1.0) {
            return;
        }

        if (consecutiveSuccesses.incrementAndGet() >= SUCCESSES_BEFORE_RECOVERY) {
            consecutiveSuccesses.set(0);

            long oldBits;
            double oldFactor;
            double newFactor;
            do {
                oldBits = currentRateFactorBits.get();
                oldFactor = Double.longBitsToDouble(oldBits);
                newFactor = Math.min(oldFactor * RECOVERY_INCREASE_FACTOR, 1.0);
                if (newFactor <= oldFactor) {
                    break;
                }
            } while (!currentRateFactorBits.compareAndSet(oldBits, Double.doubleToLongBits(newFactor)));

            if (newFactor > oldFactor) {
                double newRate = attemptsPerSecond * newFactor;
                rateLimiter.setRate(newRate);
                log.info("Recovering attempt rate to {}/sec ({}% of configured)",
                        Math.round(newRate * 10) / 10.0, Math.round(newFactor * 100));
            }
        }
    }

    /**
     * Returns the current rate factor (1.0 = full rate, lower = reduced after failures).
     *
     * @return current rate factor between 0.1 and 1.0
     */
    public double getCurrentRateFactor() {
        return Double.longBitsToDouble(currentRateFactorBits.get());
    }

    /**
     * Returns whether rate limiting is enabled.
     *
     * @return true if rate limiting is active
     */
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Disposes the blocking scheduler when the bean is destroyed.
     */
    @Override
    public void destroy() {
        if (enabled && blockingScheduler != null) {
            blockingScheduler.dispose();
            log.info("Connect attempt limiter scheduler disposed");
        }
    }
}
