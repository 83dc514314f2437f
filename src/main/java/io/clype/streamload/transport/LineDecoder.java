package io.clype.streamload.transport;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import reactor.core.publisher.Flux;

/**
 * Splits a byte stream into UTF-8 lines terminated by {@code \n} (an optional {@code \r} before it
 * is dropped).
 *
 * <p>Splitting happens on bytes, so multi-byte characters spanning two chunks are decoded
 * correctly. A line longer than the configured ceiling fails the stream instead of growing
 * the pending buffer without bound. Bytes after the last newline are discarded at end of
 * stream.</p>
 *
 * <p>Instances are stateful and not thread-safe; {@link #decode(Flux, int)} creates one per
 * subscription.</p>
 */
final class LineDecoder {

    /** Default upper bound for a single line: 1 MiB. */
    static final int DEFAULT_MAX_LINE_BYTES = 1024 * 1024;

    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private final int maxLineBytes;

    LineDecoder(int maxLineBytes) {
        if (maxLineBytes <= 0) {
            throw new IllegalArgumentException("maxLineBytes must be positive");
        }
        this.maxLineBytes = maxLineBytes;
    }

    /**
     * Decodes a chunk stream into lines.
     *
     * @param chunks       raw bytes as received from the socket
     * @param maxLineBytes upper bound for a single line
     * @return the lines, without terminators
     */
    static Flux<String> decode(Flux<ByteBuffer> chunks, int maxLineBytes) {
        return Flux.defer(() -> {
            LineDecoder decoder = new LineDecoder(maxLineBytes);
            return chunks.concatMapIterable(decoder::feed);
        });
    }

    /**
     * Consumes one chunk and returns the lines it completed.
     *
     * @param chunk bytes to consume; its position is advanced to the limit
     * @return completed lines, possibly empty
     * @throws IllegalStateException if a line exceeds the ceiling
     */
    List<String> feed(ByteBuffer chunk) {
        List<String> lines = new ArrayList<>();
        int start = chunk.position();
        int limit = chunk.limit();
        for (int i = start; i < limit; i++) {
            if (chunk.get(i) == '\n') {
                append(chunk, start, i);
                lines.add(takeLine());
                start = i + 1;
            }
        }
        append(chunk, start, limit);
        chunk.position(limit);
        return lines;
    }

    private void append(ByteBuffer chunk, int from, int to) {
        int length = to - from;
        if (length == 0) {
            return;
        }
        if (pending.size() + length > maxLineBytes) {
            throw new IllegalStateException("Line exceeds " + maxLineBytes + " bytes");
        }
        byte[] bytes = new byte[length];
        chunk.get(from, bytes);
        pending.write(bytes, 0, length);
    }

    private String takeLine() {
        byte[] bytes = pending.toByteArray();
        pending.reset();
        int length = bytes.length;
        if (length > 0 && bytes[length - 1] == '\r') {
            length--;
        }
        return new String(bytes, 0, length, StandardCharsets.UTF_8);
    }
}
