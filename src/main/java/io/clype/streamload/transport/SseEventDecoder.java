package io.clype.streamload.transport;

import reactor.core.publisher.Flux;

/**
 * Assembles Server-Sent-Events from text lines and emits the {@code data} of each event.
 *
 * <p>Follows the event-stream format: {@code data:} lines are joined with {@code \n},
 * a blank line dispatches the event, lines starting with {@code :} are comments
 * (keep-alives) and {@code event}, {@code id} and {@code retry} fields are ignored.
 * An event without data is not dispatched.</p>
 */
final class SseEventDecoder {

    private final StringBuilder data = new StringBuilder();
    private boolean hasData;

    /**
     * Decodes a line stream into event payloads.
     *
     * @param lines event-stream lines without terminators
     * @return the data payload of each dispatched event
     */
    static Flux<String> decode(Flux<String> lines) {
        return Flux.defer(() -> {
            SseEventDecoder decoder = new SseEventDecoder();
            return lines.<String>handle((line, sink) -> {
                String event = decoder.accept(line);
                if (event != null) {
                    sink.next(event);
                }
            });
        });
    }

    /**
     * Consumes one line.
     *
     * @param line the line
     * @return the dispatched event data, or null if the line did not complete an event
     */
    String accept(String line) {
        if (line.isEmpty()) {
            return dispatch();
        }
        if (line.charAt(0) == ':') {
            return null;
        }

        int colon = line.indexOf(':');
        String field = colon < 0 ? line : line.substring(0, colon);
        String value = colon < 0 ? "" : line.substring(colon + 1);
        if (value.startsWith(" ")) {
            value = value.substring(1);
        }

        if ("data".equals(field)) {
            if (hasData) {
                data.append('\n');
            }
            data.append(value);
            hasData = true;
        }
        return null;
    }

    private String dispatch() {
        if (!hasData) {
            return null;
        }
        String event = data.toString();
        data.setLength(0);
        hasData = false;
        return event;
    }
}
