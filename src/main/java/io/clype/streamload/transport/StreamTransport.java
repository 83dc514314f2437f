package io.clype.streamload.transport;

import io.clype.streamload.model.Endpoint;

import reactor.core.publisher.Mono;

/**
 * Establishes streaming connections to an endpoint.
 *
 * <p>Implementations must be non-blocking and thread-safe: a single instance is shared
 * by every worker of a pool.</p>
 */
public interface StreamTransport {

    /**
     * Opens a new connection.
     *
     * <p>The returned Mono emits the connection once it is established, or fails with a
     * {@link io.clype.streamload.model.ConnectionFailureException} of stage {@code ESTABLISH}.
     * Cancelling the Mono before it emits releases any half-open resources.</p>
     *
     * @param endpoint the target endpoint
     * @return a Mono of the established connection
     */
    Mono<StreamConnection> connect(Endpoint endpoint);
}
