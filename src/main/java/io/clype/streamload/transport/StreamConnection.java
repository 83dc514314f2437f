package io.clype.streamload.transport;

import reactor.core.publisher.Flux;

/**
 * One established streaming connection, owned by exactly one worker.
 */
public interface StreamConnection extends AutoCloseable {

    /**
     * Returns the inbound messages of this connection.
     *
     * <p>The Flux completes on a clean end of stream and fails with a
     * {@link io.clype.streamload.model.ConnectionFailureException} of stage {@code RECEIVE}
     * when the connection drops abnormally. It may be subscribed only once. Demand is
     * propagated to the socket, so a slow subscriber never causes unbounded buffering.</p>
     *
     * @return the message stream
     */
    Flux<String> messages();

    /**
     * Closes the connection. Idempotent; never throws.
     */
    @Override
    void close();
}
