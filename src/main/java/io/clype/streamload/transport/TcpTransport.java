package io.clype.streamload.transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousSocketChannel;
import java.nio.channels.CompletionHandler;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.streamload.model.ConnectionFailureException;
import io.clype.streamload.model.ConnectionFailureException.Stage;
import io.clype.streamload.model.Endpoint;

import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Raw TCP transport for newline-delimited JSON streams ({@code tcp://host:port}).
 *
 * <p>Each non-blank line is one message. End of stream from the peer is a clean closure.
 * Uses {@link AsynchronousSocketChannel}, so an idle connection holds no thread; a read is
 * only issued while the subscriber has outstanding demand.</p>
 */
public class TcpTransport implements StreamTransport {

    private static final Logger log = LoggerFactory.getLogger(TcpTransport.class);

    /** Size of the per-connection read buffer. */
    static final int READ_BUFFER_SIZE = 8 * 1024;

    private final Scheduler resolveScheduler;
    private final int maxLineBytes;

    /**
     * Creates a transport with the default line ceiling.
     *
     * @param resolveScheduler scheduler for the blocking host name resolution
     */
    public TcpTransport(Scheduler resolveScheduler) {
        this(resolveScheduler, LineDecoder.DEFAULT_MAX_LINE_BYTES);
    }

    /**
     * Creates a transport.
     *
     * @param resolveScheduler scheduler for the blocking host name resolution
     * @param maxLineBytes     upper bound for a single line
     */
    public TcpTransport(Scheduler resolveScheduler, int maxLineBytes) {
        this.resolveScheduler = Objects.requireNonNull(resolveScheduler, "resolveScheduler cannot be null");
        if (maxLineBytes <= 0) {
            throw new IllegalArgumentException("maxLineBytes must be positive");
        }
        this.maxLineBytes = maxLineBytes;
    }

    @Override
    public Mono<StreamConnection> connect(Endpoint endpoint) {
        URI uri = endpoint.uri();
        return Mono.fromCallable(() -> new InetSocketAddress(uri.getHost(), uri.getPort()))
                .subscribeOn(resolveScheduler)
                .flatMap(address -> {
                    if (address.isUnresolved()) {
                        return Mono.error(new ConnectionFailureException(Stage.ESTABLISH, uri,
                                "unknown host " + uri.getHost()));
                    }
                    return openChannel(uri, address);
                });
    }

    private Mono<StreamConnection> openChannel(URI uri, InetSocketAddress address) {
        return Mono.create(sink -> {
            AsynchronousSocketChannel channel;
            try {
                channel = AsynchronousSocketChannel.open();
            } catch (IOException e) {
                sink.error(new ConnectionFailureException(Stage.ESTABLISH, uri, Transports.describe(e), e));
                return;
            }

            AtomicBoolean established = new AtomicBoolean(false);
            channel.connect(address, null, new CompletionHandler<Void, Void>() {
                @Override
                public void completed(Void result, Void attachment) {
                    established.set(true);
                    sink.success(new TcpConnection(uri, channel, maxLineBytes));
                }

                @Override
                public void failed(Throwable error, Void attachment) {
                    closeQuietly(uri, channel);
                    sink.error(new ConnectionFailureException(Stage.ESTABLISH, uri, Transports.describe(error), error));
                }
            });
            sink.onCancel(() -> {
                if (!established.get()) {
                    closeQuietly(uri, channel);
                }
            });
        });
    }

    private static void closeQuietly(URI uri, AsynchronousSocketChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Failed to close channel to {}: {}", uri, Transports.describe(e));
        }
    }

    /**
     * Connection handle over an open socket channel.
     */
    static final class TcpConnection extends AbstractStreamConnection {

        private final AsynchronousSocketChannel channel;
        private final int maxLineBytes;

        TcpConnection(URI uri, AsynchronousSocketChannel channel, int maxLineBytes) {
            super(uri);
            this.channel = channel;
            this.maxLineBytes = maxLineBytes;
        }

        @Override
        protected Flux<String> inbound() {
            Flux<ByteBuffer> chunks = Flux.create(sink -> {
                ChannelReader reader = new ChannelReader(sink);
                sink.onRequest(n -> reader.readIfDemanded());
                sink.onDispose(() -> closeQuietly(uri(), channel));
            });
            return LineDecoder.decode(chunks, maxLineBytes)
                    .filter(line -> !line.isBlank());
        }

        @Override
        protected void release(boolean wasSubscribed) {
            closeQuietly(uri(), channel);
        }

        /**
         * Keeps at most one read outstanding and only while downstream has demand.
         */
        private final class ChannelReader implements CompletionHandler<Integer, Void> {

            private final FluxSink<ByteBuffer> sink;
            private final ByteBuffer buffer = ByteBuffer.allocate(READ_BUFFER_SIZE);
            private final AtomicBoolean reading = new AtomicBoolean(false);

            ChannelReader(FluxSink<ByteBuffer> sink) {
                this.sink = sink;
            }

            void readIfDemanded() {
                if (sink.isCancelled() || sink.requestedFromDownstream() == 0) {
                    return;
                }
                if (reading.compareAndSet(false, true)) {
                    buffer.clear();
                    channel.read(buffer, null, this);
                }
            }

            @Override
            public void completed(Integer bytesRead, Void attachment) {
                if (bytesRead < 0) {
                    sink.complete();
                    return;
                }
                buffer.flip();
                ByteBuffer chunk = ByteBuffer.allocate(buffer.remaining());
                chunk.put(buffer);
                chunk.flip();
                reading.set(false);
                sink.next(chunk);
                readIfDemanded();
            }

            @Override
            public void failed(Throwable error, Void attachment) {
                reading.set(false);
                if (isClosed()) {
                    sink.complete();
                } else {
                    sink.error(new ConnectionFailureException(Stage.RECEIVE, uri(), Transports.describe(error), error));
                }
            }
        }
    }
}
