package io.clype.streamload.transport;

import java.util.concurrent.CompletionException;
import java.util.concurrent.Flow;
import java.util.regex.Pattern;

/**
 * Helpers shared by the transport implementations.
 */
final class Transports {

    /** Pattern for sanitizing remote strings before they reach a log line. */
    private static final Pattern LOG_SANITIZE_PATTERN = Pattern.compile("[\\p{Cntrl}\\p{Cc}]");

    private Transports() {
    }

    /**
     * Unwraps the {@link CompletionException} layer added by {@code CompletableFuture}.
     */
    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Short, log-safe description of a failure: exception type plus message.
     */
    static String describe(Throwable error) {
        Throwable cause = unwrap(error);
        String message = cause.getMessage();
        String text = message == null
                ? cause.getClass().getSimpleName()
                : cause.getClass().getSimpleName() + ": " + message;
        return sanitize(text);
    }

    /**
     * Replaces control characters so a remote string cannot forge log lines.
     */
    static String sanitize(String input) {
        if (input == null) {
            return "null";
        }
        return LOG_SANITIZE_PATTERN.matcher(input).replaceAll("_");
    }

    /**
     * Subscribes to a body publisher only to cancel it, releasing the underlying connection.
     */
    static <T> void discard(Flow.Publisher<T> publisher) {
        publisher.subscribe(new Flow.Subscriber<T>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                subscription.cancel();
            }

            @Override
            public void onNext(T item) {
                // cancelled on subscribe
            }

            @Override
            public void onError(Throwable throwable) {
                // cancelled on subscribe
            }

            @Override
            public void onComplete() {
                // cancelled on subscribe
            }
        });
    }
}
