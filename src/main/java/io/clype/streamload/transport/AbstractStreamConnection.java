package io.clype.streamload.transport;

import java.net.URI;
import java.util.concurrent.atomic.AtomicBoolean;

import io.clype.streamload.model.ConnectionFailureException;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Common single-subscription and close handling for stream connections.
 *
 * <p>Closing the connection completes an active message stream and then calls
 * {@link #release(boolean)} exactly once.</p>
 */
abstract class AbstractStreamConnection implements StreamConnection {

    private final URI uri;
    private final AtomicBoolean subscribed = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Sinks.One<Boolean> closeSignal = Sinks.one();

    AbstractStreamConnection(URI uri) {
        this.uri = uri;
    }

    @Override
    public final Flux<String> messages() {
        if (!subscribed.compareAndSet(false, true)) {
            return Flux.error(new IllegalStateException("messages() may only be subscribed once"));
        }
        return inbound()
                .takeUntilOther(closeSignal.asMono())
                .onErrorMap(e -> !(e instanceof ConnectionFailureException),
                        e -> new ConnectionFailureException(ConnectionFailureException.Stage.RECEIVE, uri,
                                Transports.describe(e), e));
    }

    @Override
    public final void close() {
        if (closed.compareAndSet(false, true)) {
            closeSignal.tryEmitValue(Boolean.TRUE);
            release(subscribed.get());
        }
    }

    /**
     * Returns whether {@link #close()} has been called.
     *
     * @return true once closed
     */
    protected boolean isClosed() {
        return closed.get();
    }

    protected URI uri() {
        return uri;
    }

    /**
     * Raw inbound messages; subscribed at most once.
     *
     * @return the message stream
     */
    protected abstract Flux<String> inbound();

    /**
     * Releases the underlying resources.
     *
     * @param wasSubscribed whether {@link #inbound()} was ever subscribed
     */
    protected abstract void release(boolean wasSubscribed);
}
