package io.clype.streamload.model;

import java.net.URI;

/**
 * A stream connection could not be established or was dropped abnormally.
 *
 * <p>Workers absorb this exception into the error counter and retry after the
 * reconnect backoff; it is never propagated out of the pool.</p>
 */
public class ConnectionFailureException extends RuntimeException {

    /** Where in the connection lifecycle the failure happened. */
    public enum Stage {
        /** Before the connection was established. */
        ESTABLISH,
        /** After the connection was established, while receiving. */
        RECEIVE
    }

    private final Stage stage;
    private final URI endpoint;

    /**
     * Creates a new ConnectionFailureException.
     *
     * @param stage    lifecycle stage of the failure
     * @param endpoint the endpoint URI
     * @param message  description of the failure
     * @param cause    underlying cause (may be null)
     */
    public ConnectionFailureException(Stage stage, URI endpoint, String message, Throwable cause) {
        super(stage + " failed for " + endpoint + ": " + message, cause);
        this.stage = stage;
        this.endpoint = endpoint;
    }

    /**
     * Creates a new ConnectionFailureException without a cause.
     *
     * @param stage    lifecycle stage of the failure
     * @param endpoint the endpoint URI
     * @param message  description of the failure
     */
    public ConnectionFailureException(Stage stage, URI endpoint, String message) {
        this(stage, endpoint, message, null);
    }

    /**
     * Returns the lifecycle stage of the failure.
     *
     * @return the stage
     */
    public Stage getStage() {
        return stage;
    }

    /**
     * Returns the endpoint the failure relates to.
     *
     * @return the endpoint URI
     */
    public URI getEndpoint() {
        return endpoint;
    }
}
