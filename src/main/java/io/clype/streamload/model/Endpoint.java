package io.clype.streamload.model;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Target of the load harness: where to connect and how.
 *
 * <p>Created once at startup and shared read-only by every worker.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * Endpoint endpoint = Endpoint.of("ws://localhost:8080/");
 * Endpoint sse = new Endpoint(
 *     URI.create("http://localhost:8080/sse"),
 *     Duration.ofSeconds(5),                 // connectTimeout
 *     Duration.ofSeconds(30),                // idleTimeout
 *     Map.of("Authorization", "Bearer ..."));
 * }</pre>
 *
 * @param uri            target URI; its scheme selects the {@link TransportType}
 * @param connectTimeout maximum time to establish a connection
 * @param idleTimeout    maximum time between two received messages before the
 *                       connection is considered dropped
 * @param headers        extra request headers (WebSocket upgrade and SSE request only)
 */
public record Endpoint(
    URI uri,
    Duration connectTimeout,
    Duration idleTimeout,
    Map<String, String> headers
) {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(60);

    /**
     * Creates a validated endpoint.
     *
     * @throws NullPointerException     if any component is null
     * @throws IllegalArgumentException if the scheme is unsupported, the URI has no host,
     *                                  a TCP URI has no port, or a timeout is not positive
     */
    public Endpoint {
        Objects.requireNonNull(uri, "uri cannot be null");
        Objects.requireNonNull(connectTimeout, "connectTimeout cannot be null");
        Objects.requireNonNull(idleTimeout, "idleTimeout cannot be null");
        Objects.requireNonNull(headers, "headers cannot be null");

        TransportType type = TransportType.fromUri(uri);
        if (uri.getHost() == null || uri.getHost().isEmpty()) {
            throw new IllegalArgumentException("Endpoint URI has no host: " + uri);
        }
        if (type == TransportType.TCP && uri.getPort() < 0) {
            throw new IllegalArgumentException("TCP endpoint requires an explicit port: " + uri);
        }
        if (connectTimeout.isZero() || connectTimeout.isNegative()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (idleTimeout.isZero() || idleTimeout.isNegative()) {
            throw new IllegalArgumentException("idleTimeout must be positive");
        }
        headers = Map.copyOf(headers);
    }

    /**
     * Creates an endpoint with default timeouts and no extra headers.
     *
     * @param uri the target URI, e.g. {@code ws://localhost:8080/}
     * @return the endpoint
     */
    public static Endpoint of(String uri) {
        return new Endpoint(URI.create(uri), DEFAULT_CONNECT_TIMEOUT, DEFAULT_IDLE_TIMEOUT, Map.of());
    }

    /**
     * Returns the transport selected by the URI scheme.
     *
     * @return the transport type
     */
    public TransportType transportType() {
        return TransportType.fromUri(uri);
    }

    /**
     * Returns the host used for metric tags and log lines.
     *
     * @return host, with port when one is set
     */
    public String hostTag() {
        return uri.getPort() < 0 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
    }
}
