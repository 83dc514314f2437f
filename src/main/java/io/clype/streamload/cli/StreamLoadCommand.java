package io.clype.streamload.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import io.clype.streamload.config.StreamLoadProperties;
import io.clype.streamload.model.Endpoint;
import io.clype.streamload.model.PoolConfig;
import io.clype.streamload.pool.PoolSupervisor;

import reactor.core.publisher.Sinks;

/**
 * Command-line entry point: {@code run <endpoint> [worker_count]}.
 *
 * <p>Positional arguments override the {@code streamload.endpoint.url} and
 * {@code streamload.pool.worker-count} defaults; any {@code --streamload.*} option is passed
 * to Spring Boot as is and wins over the positional value for the same key.</p>
 *
 * <p>The CLI's own defaults (the endpoint that switches the auto-configuration on, and a
 * WARN root log level that keeps stdout line oriented) are registered as Spring Boot default
 * properties here, so applications embedding the library never pick them up.</p>
 *
 * <p>The pool runs until the process receives SIGINT. The shutdown hook requests the stop,
 * waits for the final summary and exits with status 0. Usage errors exit with status 2.</p>
 */
@SpringBootConfiguration
@EnableAutoConfiguration
public class StreamLoadCommand {

    private static final Logger log = LoggerFactory.getLogger(StreamLoadCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: streamload run <endpoint> [worker_count] [--streamload.<property>=<value> ...]",
            "  endpoint      ws://, wss://, http://, https:// or tcp://host:port (default " + StreamLoadProperties.DEFAULT_URL + ")",
            "  worker_count  number of concurrent connections, 0.." + PoolConfig.MAX_WORKER_COUNT
                    + " (default " + PoolConfig.DEFAULT_WORKER_COUNT + ")");

    private static final String URL_PROPERTY = "streamload.endpoint.url";
    private static final String WORKER_COUNT_PROPERTY = "streamload.pool.worker-count";

    /** Extra wait beyond the grace period before the shutdown hook gives up on the summary. */
    private static final long SUMMARY_WAIT_MARGIN_MILLIS = 5_000;

    public static void main(String[] args) {
        Invocation invocation;
        try {
            invocation = parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(EXIT_USAGE);
            return;
        }

        ConfigurableApplicationContext context = new SpringApplicationBuilder(StreamLoadCommand.class)
                .web(WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .registerShutdownHook(false)
                .properties(defaultProperties())
                .run(invocation.springArgs());

        PoolSupervisor supervisor = context.getBean(PoolSupervisor.class);
        StreamLoadProperties properties = context.getBean(StreamLoadProperties.class);
        long summaryWaitMillis = properties.getPool().getShutdownGracePeriod().toMillis() + SUMMARY_WAIT_MARGIN_MILLIS;

        Sinks.Empty<Void> interrupt = Sinks.empty();
        CountDownLatch finished = new CountDownLatch(1);
        PrintStream out = System.out;

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            interrupt.tryEmitEmpty();
            try {
                if (!finished.await(summaryWaitMillis, TimeUnit.MILLISECONDS)) {
                    log.warn("Final summary not printed within {}ms, exiting anyway", summaryWaitMillis);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            out.flush();
            // An interrupt is the normal way to end a run, not a failure.
            Runtime.getRuntime().halt(EXIT_OK);
        }, "streamload-shutdown"));

        try {
            supervisor.run(interrupt.asMono());
        } finally {
            context.close();
            out.flush();
            finished.countDown();
        }
    }

    /**
     * Returns the lowest-precedence properties of a CLI run; any command-line option or
     * configuration file overrides them.
     *
     * @return the CLI default properties
     */
    static Map<String, Object> defaultProperties() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put(URL_PROPERTY, StreamLoadProperties.DEFAULT_URL);
        defaults.put("logging.level.root", "WARN");
        return defaults;
    }

    /**
     * Parses the command line.
     *
     * @param args raw arguments
     * @return the Spring Boot arguments to start the context with
     * @throws IllegalArgumentException on a usage error
     */
    static Invocation parse(String[] args) {
        List<String> positional = new ArrayList<>();
        List<String> options = new ArrayList<>();
        for (String arg : args) {
            if (arg.startsWith("--")) {
                options.add(arg);
            } else {
                positional.add(arg);
            }
        }

        if (positional.isEmpty() || !"run".equals(positional.get(0))) {
            throw new IllegalArgumentException("expected the 'run' command");
        }
        if (positional.size() > 3) {
            throw new IllegalArgumentException("unexpected arguments: "
                    + String.join(" ", positional.subList(3, positional.size())));
        }

        List<String> springArgs = new ArrayList<>(options);
        if (positional.size() > 1) {
            String url = positional.get(1);
            try {
                Endpoint.of(url);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("invalid endpoint '" + url + "': " + e.getMessage(), e);
            }
            addUnlessOverridden(springArgs, options, URL_PROPERTY, url);
        }
        if (positional.size() > 2) {
            String raw = positional.get(2);
            int workerCount;
            try {
                workerCount = Integer.parseInt(raw);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("worker_count must be an integer, got: " + raw, e);
            }
            if (workerCount < 0 || workerCount > PoolConfig.MAX_WORKER_COUNT) {
                throw new IllegalArgumentException("worker_count must be between 0 and "
                        + PoolConfig.MAX_WORKER_COUNT + ", got: " + workerCount);
            }
            addUnlessOverridden(springArgs, options, WORKER_COUNT_PROPERTY, Integer.toString(workerCount));
        }
        return new Invocation(springArgs.toArray(String[]::new));
    }

    private static void addUnlessOverridden(List<String> springArgs, List<String> options, String key, String value) {
        String prefix = "--" + key + "=";
        if (options.stream().noneMatch(option -> option.startsWith(prefix))) {
            springArgs.add(prefix + value);
        }
    }

    /**
     * A parsed command line.
     *
     * @param springArgs arguments for the Spring Boot application, positional values included as options
     */
    record Invocation(String[] springArgs) {

        @Override
        public String toString() {
            return "Invocation" + Arrays.toString(springArgs);
        }
    }
}
