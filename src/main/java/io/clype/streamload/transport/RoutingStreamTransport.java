package io.clype.streamload.transport;

import java.net.http.HttpClient;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import io.clype.streamload.model.Endpoint;
import io.clype.streamload.model.TransportType;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Dispatches each connection to the transport matching the endpoint URI scheme.
 */
public class RoutingStreamTransport implements StreamTransport {

    private final Map<TransportType, StreamTransport> transports;

    /**
     * Creates a router over explicit transports.
     *
     * @param transports one transport per supported type; missing types fail at connect time
     */
    public RoutingStreamTransport(Map<TransportType, StreamTransport> transports) {
        Objects.requireNonNull(transports, "transports cannot be null");
        this.transports = transports.isEmpty()
                ? new EnumMap<>(TransportType.class)
                : new EnumMap<>(transports);
    }

    /**
     * Creates the default router: WebSocket and SSE over one HTTP/1.1 client, TCP over
     * asynchronous socket channels.
     *
     * @return the router
     */
    public static RoutingStreamTransport createDefault() {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        Map<TransportType, StreamTransport> transports = new EnumMap<>(TransportType.class);
        transports.put(TransportType.WEBSOCKET, new WebSocketTransport(httpClient));
        transports.put(TransportType.SSE, new SseTransport(httpClient));
        transports.put(TransportType.TCP, new TcpTransport(Schedulers.boundedElastic()));
        return new RoutingStreamTransport(transports);
    }

    @Override
    public Mono<StreamConnection> connect(Endpoint endpoint) {
        StreamTransport transport = transports.get(endpoint.transportType());
        if (transport == null) {
            return Mono.error(new IllegalArgumentException(
                    "No transport registered for " + endpoint.transportType()));
        }
        return transport.connect(endpoint);
    }
}
