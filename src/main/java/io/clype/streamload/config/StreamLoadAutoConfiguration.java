package io.clype.streamload.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import io.clype.streamload.metrics.MetricsAggregator;
import io.clype.streamload.metrics.StreamLoadMetrics;
import io.clype.streamload.pool.PoolSupervisor;
import io.clype.streamload.ratelimit.ConnectAttemptLimiter;
import io.clype.streamload.transport.RoutingStreamTransport;
import io.clype.streamload.transport.StreamTransport;

import reactor.core.scheduler.Schedulers;

/**
 * Spring Boot auto-configuration for the stream load harness.
 *
 * <p>This configuration is automatically enabled when the {@code streamload.endpoint.url}
 * property is set in your application configuration.</p>
 *
 * <p><b>Configuration Example (application.yml):</b></p>
 * <pre>{@code
 * streamload:
 *   endpoint:
 *     url: ws://localhost:8080/
 *   pool:
 *     worker-count: 500        # Optional, default: 500
 *     stagger-delay: 20ms      # Optional, default: 20ms
 * }</pre>
 *
 * <p><b>Bean Customization:</b> All beans created by this configuration use
 * {@code @ConditionalOnMissingBean}, allowing you to provide your own implementations
 * (a custom {@link StreamTransport} for an in-process target, for example) by defining
 * beans of the same type in your application configuration.</p>
 *
 * @see StreamLoadProperties
 * @see PoolSupervisor
 */
@AutoConfiguration
@EnableConfigurationProperties(StreamLoadProperties.class)
@ConditionalOnProperty(prefix = "streamload.endpoint", name = "url")
public class StreamLoadAutoConfiguration {

    private final StreamLoadProperties properties;

    /**
     * Creates the auto-configuration with the given properties.
     *
     * @param properties the stream load configuration properties
     */
    public StreamLoadAutoConfiguration(StreamLoadProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates the counters shared by every worker of the pool.
     *
     * @return a fresh aggregator
     */
    @Bean
    @ConditionalOnMissingBean
    public MetricsAggregator metricsAggregator() {
        return new MetricsAggregator();
    }

    /**
     * Creates the transport that picks WebSocket, SSE or TCP from the endpoint scheme.
     *
     * @return the routing transport
     */
    @Bean
    @ConditionalOnMissingBean
    public StreamTransport streamTransport() {
        return RoutingStreamTransport.createDefault();
    }

    /**
     * Creates the pool-wide connection attempt limiter.
     *
     * <p>When disabled, returns a no-op limiter that lets every attempt through.</p>
     *
     * @return the limiter
     */
    @Bean
    @ConditionalOnMissingBean
    public ConnectAttemptLimiter connectAttemptLimiter() {
        var config = properties.getConnectRateLimit();
        if (!config.isEnabled()) {
            return ConnectAttemptLimiter.disabled();
        }
        return new ConnectAttemptLimiter(
                config.getAttemptsPerSecond(),
                config.getWarmupPeriod(),
                Schedulers.newBoundedElastic(4, Integer.MAX_VALUE, "streamload-connect-limiter"));
    }

    /**
     * Creates the pool supervisor.
     *
     * @param transport  transport shared by every worker
     * @param aggregator shared counters
     * @param limiter    connection attempt limiter
     * @param metrics    optional metrics collector (may be null if metrics are disabled)
     * @return the supervisor; not started
     */
    @Bean
    @ConditionalOnMissingBean
    public PoolSupervisor poolSupervisor(
            StreamTransport transport,
            MetricsAggregator aggregator,
            ConnectAttemptLimiter limiter,
            @Autowired(required = false) StreamLoadMetrics metrics) {
        return new PoolSupervisor(
                properties.toPoolConfig(),
                properties.toEndpoint(),
                transport,
                aggregator,
                metrics,
                limiter,
                message -> { },
                System.out);
    }
}
