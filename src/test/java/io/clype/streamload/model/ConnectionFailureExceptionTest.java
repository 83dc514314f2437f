package io.clype.streamload.model;

import java.io.IOException;
import java.net.URI;

import org.junit.jupiter.api.Test;

import io.clype.streamload.model.ConnectionFailureException.Stage;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionFailureExceptionTest {

    @Test
    void shouldCarryStageAndEndpoint() {
        URI uri = URI.create("tcp://localhost:9000");
        IOException cause = new IOException("Connection refused");

        ConnectionFailureException e = new ConnectionFailureException(Stage.ESTABLISH, uri, "Connection refused", cause);

        assertEquals(Stage.ESTABLISH, e.getStage());
        assertEquals(uri, e.getEndpoint());
        assertSame(cause, e.getCause());
        assertEquals("ESTABLISH failed for tcp://localhost:9000: Connection refused", e.getMessage());
    }
}
