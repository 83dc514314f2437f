package io.clype.streamload.transport;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.streamload.model.ConnectionFailureException;
import io.clype.streamload.model.ConnectionFailureException.Stage;
import io.clype.streamload.model.Endpoint;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * WebSocket transport on top of the JDK {@link HttpClient}.
 *
 * <p>Each complete text or binary message is one stream message. Ping frames are answered
 * by the JDK client. A close frame with status 1000 (or no status) ends the stream cleanly;
 * any other status is an abnormal closure.</p>
 *
 * <p>Only one frame is requested from the socket at a time, and the next one only after the
 * previous message was consumed downstream.</p>
 */
public class WebSocketTransport implements StreamTransport {

    private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);

    /** Close status sent by the JDK when the peer's close frame carried no status code. */
    private static final int NO_STATUS_RECEIVED = 1005;

    private final HttpClient httpClient;

    /**
     * Creates a transport backed by the given client.
     *
     * @param httpClient the shared JDK HTTP client
     */
    public WebSocketTransport(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
    }

    @Override
    public Mono<StreamConnection> connect(Endpoint endpoint) {
        URI uri = endpoint.uri();
        return Mono.create(sink -> {
            WebSocketConnection connection = new WebSocketConnection(uri);
            WebSocket.Builder builder = httpClient.newWebSocketBuilder()
                    .connectTimeout(endpoint.connectTimeout());
            endpoint.headers().forEach(builder::header);

            CompletableFuture<WebSocket> future = builder.buildAsync(uri, connection);
            future.whenComplete((webSocket, error) -> {
                if (error != null) {
                    sink.error(new ConnectionFailureException(Stage.ESTABLISH, uri, Transports.describe(error),
                            Transports.unwrap(error)));
                } else {
                    sink.success(connection);
                }
            });
            // A handshake that completes after cancellation must not leak its socket
            sink.onCancel(() -> future.whenComplete((webSocket, error) -> {
                if (webSocket != null) {
                    webSocket.abort();
                }
            }));
        });
    }

    /**
     * Listener and connection handle for one WebSocket.
     *
     * <p>The JDK invokes listener methods sequentially, so the partial-message buffers
     * need no synchronization.</p>
     */
    static final class WebSocketConnection extends AbstractStreamConnection implements WebSocket.Listener {

        private final Sinks.Many<String> inbound = Sinks.many().unicast().onBackpressureBuffer();
        private final StringBuilder partialText = new StringBuilder();
        private final ByteArrayOutputStream partialBinary = new ByteArrayOutputStream();
        private volatile WebSocket webSocket;

        WebSocketConnection(URI uri) {
            super(uri);
        }

        @Override
        protected Flux<String> inbound() {
            return inbound.asFlux()
                    .doOnNext(message -> requestNext());
        }

        @Override
        protected void release(boolean wasSubscribed) {
            WebSocket socket = webSocket;
            if (socket == null) {
                return;
            }
            if (socket.isOutputClosed()) {
                socket.abort();
                return;
            }
            socket.sendClose(WebSocket.NORMAL_CLOSURE, "")
                    .whenComplete((ws, error) -> socket.abort());
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            this.webSocket = webSocket;
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partialText.append(data);
            if (last) {
                String message = partialText.toString();
                partialText.setLength(0);
                inbound.tryEmitNext(message);
            } else {
                webSocket.request(1);
            }
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            byte[] bytes = new byte[data.remaining()];
            data.get(bytes);
            partialBinary.write(bytes, 0, bytes.length);
            if (last) {
                String message = partialBinary.toString(StandardCharsets.UTF_8);
                partialBinary.reset();
                inbound.tryEmitNext(message);
            } else {
                webSocket.request(1);
            }
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            if (statusCode == WebSocket.NORMAL_CLOSURE || statusCode == NO_STATUS_RECEIVED) {
                inbound.tryEmitComplete();
            } else {
                String detail = reason == null || reason.isEmpty() ? "" : " (" + Transports.sanitize(reason) + ")";
                inbound.tryEmitError(new ConnectionFailureException(Stage.RECEIVE, uri(),
                        "closed with status " + statusCode + detail));
            }
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            if (isClosed()) {
                log.debug("Ignoring error after local close of {}: {}", uri(), Transports.describe(error));
                return;
            }
            inbound.tryEmitError(new ConnectionFailureException(Stage.RECEIVE, uri(), Transports.describe(error), error));
        }

        private void requestNext() {
            WebSocket socket = webSocket;
            if (socket != null) {
                socket.request(1);
            }
        }
    }
}
