package io.clype.streamload.model;

import java.net.URI;
import java.util.Locale;

/**
 * Wire protocol used to consume a stream, derived from the endpoint URI scheme.
 */
public enum TransportType {

    /** RFC 6455 WebSocket, one text message per event ({@code ws://}, {@code wss://}). */
    WEBSOCKET,

    /** Server-Sent-Events over HTTP, one {@code data:} event per message ({@code http://}, {@code https://}). */
    SSE,

    /** Raw TCP carrying newline-delimited JSON, one line per message ({@code tcp://}). */
    TCP;

    /**
     * Resolves the transport for a URI scheme.
     *
     * @param uri the endpoint URI
     * @return the matching transport type
     * @throws IllegalArgumentException if the URI has no scheme or the scheme is not supported
     */
    public static TransportType fromUri(URI uri) {
        String scheme = uri.getScheme();
        if (scheme == null) {
            throw new IllegalArgumentException("Endpoint URI has no scheme: " + uri);
        }
        switch (scheme.toLowerCase(Locale.ROOT)) {
            case "ws":
            case "wss":
                return WEBSOCKET;
            case "http":
            case "https":
                return SSE;
            case "tcp":
                return TCP;
            default:
                throw new IllegalArgumentException(
                        "Unsupported endpoint scheme '" + scheme + "'. Expected one of: ws, wss, http, https, tcp");
        }
    }
}
