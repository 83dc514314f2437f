package io.clype.streamload.transport;

import java.io.IOException;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransportsTest {

    @Test
    void sanitizeReplacesControlCharacters() {
        assertEquals("forged_INFO line", Transports.sanitize("forged\nINFO line"));
        assertEquals("null", Transports.sanitize(null));
    }

    @Test
    void describeUnwrapsCompletionException() {
        Throwable error = new CompletionException(new IOException("Connection reset\r\nby peer"));

        assertEquals("IOException: Connection reset__by peer", Transports.describe(error));
    }

    @Test
    void describeFallsBackToTypeName() {
        assertEquals("IllegalStateException", Transports.describe(new IllegalStateException()));
    }
}
