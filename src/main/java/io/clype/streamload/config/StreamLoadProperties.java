package io.clype.streamload.config;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.clype.streamload.model.Endpoint;
import io.clype.streamload.model.PoolConfig;

/**
 * Configuration properties for the stream load harness.
 *
 * <p>These properties are bound to the {@code streamload} prefix in your
 * application configuration.</p>
 *
 * <p><b>Example Configuration (application.yml):</b></p>
 * <pre>{@code
 * streamload:
 *   endpoint:
 *     url: wss://stream.example.org/
 *     connect-timeout: 10s
 *     idle-timeout: 60s
 *     headers:
 *       Authorization: Bearer abc
 *   pool:
 *     worker-count: 500
 *     stagger-delay: 20ms
 *     stats-interval: 5s
 *     reconnect-backoff: 1s
 *     shutdown-grace-period: 10s
 *   metrics:
 *     enabled: true
 *   connect-rate-limit:
 *     enabled: false
 *     attempts-per-second: 200
 * }</pre>
 *
 * @see StreamLoadAutoConfiguration
 */
@ConfigurationProperties(prefix = "streamload")
public class StreamLoadProperties {

    public static final String DEFAULT_URL = "ws://localhost:8080/";
    public static final int DEFAULT_ATTEMPTS_PER_SECOND = 200;

    private EndpointConfig endpoint = new EndpointConfig();
    private PoolProperties pool = new PoolProperties();
    private MetricsConfig metrics = new MetricsConfig();
    private ConnectRateLimitConfig connectRateLimit = new ConnectRateLimitConfig();

    public EndpointConfig getEndpoint() { return endpoint; }
    public void setEndpoint(EndpointConfig endpoint) { this.endpoint = endpoint; }

    public PoolProperties getPool() { return pool; }
    public void setPool(PoolProperties pool) { this.pool = pool; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public ConnectRateLimitConfig getConnectRateLimit() { return connectRateLimit; }
    public void setConnectRateLimit(ConnectRateLimitConfig connectRateLimit) { this.connectRateLimit = connectRateLimit; }

    /**
     * Builds the validated endpoint.
     *
     * @return the endpoint
     * @throws IllegalArgumentException if the URL or a timeout is invalid
     */
    public Endpoint toEndpoint() {
        return new Endpoint(URI.create(endpoint.getUrl()), endpoint.getConnectTimeout(),
                endpoint.getIdleTimeout(), endpoint.getHeaders());
    }

    /**
     * Builds the validated pool configuration.
     *
     * @return the pool configuration
     * @throws IllegalArgumentException if a value is out of range
     */
    public PoolConfig toPoolConfig() {
        return new PoolConfig(pool.getWorkerCount(), pool.getStaggerDelay(), pool.getStatsInterval(),
                pool.getReconnectBackoff(), pool.getShutdownGracePeriod());
    }

    /** Target endpoint configuration. */
    public static class EndpointConfig {
        private String url = DEFAULT_URL;
        private Duration connectTimeout = Endpoint.DEFAULT_CONNECT_TIMEOUT;
        private Duration idleTimeout = Endpoint.DEFAULT_IDLE_TIMEOUT;
        private Map<String, String> headers = new LinkedHashMap<>();

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public Duration getIdleTimeout() { return idleTimeout; }
        public void setIdleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; }

        public Map<String, String> getHeaders() { return headers; }
        public void setHeaders(Map<String, String> headers) { this.headers = headers; }
    }

    /** Pool sizing and timing. */
    public static class PoolProperties {
        private int workerCount = PoolConfig.DEFAULT_WORKER_COUNT;
        private Duration staggerDelay = PoolConfig.DEFAULT_STAGGER_DELAY;
        private Duration statsInterval = PoolConfig.DEFAULT_STATS_INTERVAL;
        private Duration reconnectBackoff = PoolConfig.DEFAULT_RECONNECT_BACKOFF;
        private Duration shutdownGracePeriod = PoolConfig.DEFAULT_SHUTDOWN_GRACE_PERIOD;

        public int getWorkerCount() { return workerCount; }
        public void setWorkerCount(int workerCount) { this.workerCount = workerCount; }

        public Duration getStaggerDelay() { return staggerDelay; }
        public void setStaggerDelay(Duration staggerDelay) { this.staggerDelay = staggerDelay; }

        public Duration getStatsInterval() { return statsInterval; }
        public void setStatsInterval(Duration statsInterval) { this.statsInterval = statsInterval; }

        public Duration getReconnectBackoff() { return reconnectBackoff; }
        public void setReconnectBackoff(Duration reconnectBackoff) { this.reconnectBackoff = reconnectBackoff; }

        public Duration getShutdownGracePeriod() { return shutdownGracePeriod; }
        public void setShutdownGracePeriod(Duration shutdownGracePeriod) { this.shutdownGracePeriod = shutdownGracePeriod; }
    }

    /** Metrics configuration. */
    public static class MetricsConfig {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    /**
     * Pool-wide connection attempt rate limiting.
     *
     * <p>When enabled, every connection attempt of every worker takes a permit from one
     * token bucket, so mass reconnects after a target restart arrive spread out.</p>
     */
    public static class ConnectRateLimitConfig {
        private boolean enabled = false;
        private int attemptsPerSecond = DEFAULT_ATTEMPTS_PER_SECOND;
        private Duration warmupPeriod = Duration.ZERO;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getAttemptsPerSecond() { return attemptsPerSecond; }
        public void setAttemptsPerSecond(int attemptsPerSecond) { this.attemptsPerSecond = attemptsPerSecond; }

        public Duration getWarmupPeriod() { return warmupPeriod; }
        public void setWarmupPeriod(Duration warmupPeriod) { this.warmupPeriod = warmupPeriod; }
    }
}
