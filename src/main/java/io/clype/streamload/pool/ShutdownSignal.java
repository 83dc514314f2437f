package io.clype.streamload.pool;

import java.util.concurrent.atomic.AtomicBoolean;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Write-once, broadcast stop notification shared by a supervisor and its workers.
 *
 * <p>Late subscribers to {@link #asMono()} still observe a signal emitted before they
 * subscribed. Signalling more than once is a no-op.</p>
 */
public final class ShutdownSignal {

    private final AtomicBoolean signaled = new AtomicBoolean(false);
    private final Sinks.One<Boolean> sink = Sinks.one();

    /**
     * Emits the signal.
     *
     * @return true if this call emitted it, false if it had already been emitted
     */
    public boolean signal() {
        if (signaled.compareAndSet(false, true)) {
            sink.tryEmitValue(Boolean.TRUE);
            return true;
        }
        return false;
    }

    /**
     * Returns whether the signal has been emitted.
     *
     * @return true once signaled
     */
    public boolean isSignaled() {
        return signaled.get();
    }

    /**
     * Returns a Mono that emits {@code true} once the signal is emitted.
     *
     * @return the signal as a Mono
     */
    public Mono<Boolean> asMono() {
        return sink.asMono();
    }
}
