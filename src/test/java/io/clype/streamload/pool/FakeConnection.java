package io.clype.streamload.pool;

import java.util.concurrent.atomic.AtomicBoolean;

import io.clype.streamload.transport.StreamConnection;

import reactor.core.publisher.Flux;

/**
 * In-memory connection whose inbound messages are a given Flux.
 */
class FakeConnection implements StreamConnection {

    private final Flux<String> messages;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    FakeConnection(Flux<String> messages) {
        this.messages = messages;
    }

    static FakeConnection silent() {
        return new FakeConnection(Flux.never());
    }

    @Override
    public Flux<String> messages() {
        return messages;
    }

    @Override
    public void close() {
        closed.set(true);
    }

    boolean isClosed() {
        return closed.get();
    }
}
