package io.clype.streamload.cli;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.clype.streamload.cli.StreamLoadCommand.Invocation;

import static org.junit.jupiter.api.Assertions.*;

class StreamLoadCommandTest {

    private static List<String> springArgs(String... args) {
        Invocation invocation = StreamLoadCommand.parse(args);
        return List.of(invocation.springArgs());
    }

    @Test
    void runWithoutArgumentsUsesConfiguredDefaults() {
        assertEquals(List.of(), springArgs("run"));
    }

    @Test
    void cliDefaultsEnablePoolAndQuietLogging() {
        Map<String, Object> defaults = StreamLoadCommand.defaultProperties();

        assertEquals("ws://localhost:8080/", defaults.get("streamload.endpoint.url"));
        assertEquals("WARN", defaults.get("logging.level.root"));
    }

    @Test
    void libraryJarShipsNoApplicationConfig() {
        ClassLoader loader = StreamLoadCommand.class.getClassLoader();

        assertNull(loader.getResource("application.yml"));
        assertNull(loader.getResource("application.properties"));
    }

    @Test
    void positionalArgumentsBecomeProperties() {
        assertEquals(List.of(
                        "--streamload.endpoint.url=wss://stream.example.org/feed",
                        "--streamload.pool.worker-count=250"),
                springArgs("run", "wss://stream.example.org/feed", "250"));
    }

    @Test
    void explicitOptionWinsOverPositionalValue() {
        assertEquals(List.of("--streamload.pool.worker-count=10", "--streamload.endpoint.url=tcp://localhost:9000"),
                springArgs("run", "tcp://localhost:9000", "20", "--streamload.pool.worker-count=10"));
    }

    @Test
    void optionsArePassedThrough() {
        assertEquals(List.of("--streamload.pool.stagger-delay=5ms"),
                springArgs("--streamload.pool.stagger-delay=5ms", "run"));
    }

    @Test
    void missingCommandIsUsageError() {
        assertThrows(IllegalArgumentException.class, () -> StreamLoadCommand.parse(new String[0]));
        assertThrows(IllegalArgumentException.class, () -> StreamLoadCommand.parse(new String[] {"start"}));
    }

    @Test
    void invalidEndpointIsUsageError() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> StreamLoadCommand.parse(new String[] {"run", "ftp://localhost/"}));
        assertTrue(e.getMessage().contains("invalid endpoint"));
    }

    @Test
    void invalidWorkerCountIsUsageError() {
        assertThrows(IllegalArgumentException.class,
                () -> StreamLoadCommand.parse(new String[] {"run", "ws://localhost:8080/", "many"}));
        assertThrows(IllegalArgumentException.class,
                () -> StreamLoadCommand.parse(new String[] {"run", "ws://localhost:8080/", "-3"}));
    }

    @Test
    void extraPositionalArgumentIsUsageError() {
        assertThrows(IllegalArgumentException.class,
                () -> StreamLoadCommand.parse(new String[] {"run", "ws://localhost:8080/", "5", "extra"}));
    }
}
