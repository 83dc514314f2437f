package io.clype.streamload.transport;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodySubscribers;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

import io.clype.streamload.model.ConnectionFailureException;
import io.clype.streamload.model.ConnectionFailureException.Stage;
import io.clype.streamload.model.Endpoint;

import reactor.adapter.JdkFlowAdapter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Server-Sent-Events transport on top of the JDK {@link HttpClient}.
 *
 * <p>Sends a {@code GET} with {@code Accept: text/event-stream} and treats the data of each
 * event as one message. The request timeout bounds the wait for the response headers only;
 * the body is streamed without a deadline. A non-2xx status fails the connection attempt.</p>
 *
 * <p>The response body is consumed through its {@link Flow.Publisher}, so bytes are only
 * pulled from the socket as fast as the subscriber requests them.</p>
 */
public class SseTransport implements StreamTransport {

    private final HttpClient httpClient;
    private final int maxLineBytes;

    /**
     * Creates a transport with the default line ceiling.
     *
     * @param httpClient the shared JDK HTTP client
     */
    public SseTransport(HttpClient httpClient) {
        this(httpClient, LineDecoder.DEFAULT_MAX_LINE_BYTES);
    }

    /**
     * Creates a transport.
     *
     * @param httpClient   the shared JDK HTTP client
     * @param maxLineBytes upper bound for a single event-stream line
     */
    public SseTransport(HttpClient httpClient, int maxLineBytes) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
        if (maxLineBytes <= 0) {
            throw new IllegalArgumentException("maxLineBytes must be positive");
        }
        this.maxLineBytes = maxLineBytes;
    }

    @Override
    public Mono<StreamConnection> connect(Endpoint endpoint) {
        URI uri = endpoint.uri();
        return Mono.create(sink -> {
            HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                    .timeout(endpoint.connectTimeout())
                    .header("Accept", "text/event-stream")
                    .header("Cache-Control", "no-cache")
                    .GET();
            endpoint.headers().forEach(request::header);

            // Error bodies are discarded so the connection is released
            HttpResponse.BodyHandler<Flow.Publisher<List<ByteBuffer>>> bodyHandler =
                    responseInfo -> isSuccess(responseInfo.statusCode())
                            ? BodySubscribers.ofPublisher()
                            : BodySubscribers.replacing(null);
            CompletableFuture<HttpResponse<Flow.Publisher<List<ByteBuffer>>>> future =
                    httpClient.sendAsync(request.build(), bodyHandler);

            future.whenComplete((response, error) -> {
                if (error != null) {
                    sink.error(new ConnectionFailureException(Stage.ESTABLISH, uri, Transports.describe(error),
                            Transports.unwrap(error)));
                } else if (!isSuccess(response.statusCode())) {
                    sink.error(new ConnectionFailureException(Stage.ESTABLISH, uri,
                            "unexpected HTTP status " + response.statusCode()));
                } else {
                    sink.success(new SseConnection(uri, response.body(), maxLineBytes));
                }
            });
            sink.onCancel(() -> future.whenComplete((response, error) -> {
                if (response != null && response.body() != null) {
                    Transports.discard(response.body());
                }
            }));
        });
    }

    private static boolean isSuccess(int statusCode) {
        return statusCode / 100 == 2;
    }

    /**
     * Connection handle over a streaming response body.
     */
    static final class SseConnection extends AbstractStreamConnection {

        private final Flow.Publisher<List<ByteBuffer>> body;
        private final int maxLineBytes;

        SseConnection(URI uri, Flow.Publisher<List<ByteBuffer>> body, int maxLineBytes) {
            super(uri);
            this.body = body;
            this.maxLineBytes = maxLineBytes;
        }

        @Override
        protected Flux<String> inbound() {
            Flux<ByteBuffer> chunks = JdkFlowAdapter.flowPublisherToFlux(body)
                    .concatMapIterable(buffers -> buffers);
            return SseEventDecoder.decode(LineDecoder.decode(chunks, maxLineBytes));
        }

        @Override
        protected void release(boolean wasSubscribed) {
            // A subscribed body is cancelled through the message stream
            if (!wasSubscribed) {
                Transports.discard(body);
            }
        }
    }
}
