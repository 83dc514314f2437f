package io.clype.streamload.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import io.clype.streamload.metrics.MetricsAggregator;
import io.clype.streamload.metrics.StreamLoadMetrics;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Auto-configuration for stream load metrics.
 *
 * <p>This configuration is automatically enabled when:</p>
 * <ul>
 *   <li>Micrometer is on the classpath</li>
 *   <li>A {@link MeterRegistry} bean exists</li>
 *   <li>The {@code streamload.metrics.enabled} property is true (default)</li>
 * </ul>
 *
 * @see StreamLoadMetrics
 */
@AutoConfiguration(after = StreamLoadAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnBean({MeterRegistry.class, MetricsAggregator.class})
@ConditionalOnProperty(prefix = "streamload.metrics", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class StreamLoadMetricsAutoConfiguration {

    /**
     * Creates the stream load metrics bean.
     *
     * @param registry   the Micrometer meter registry
     * @param aggregator the counters to publish
     * @param properties the stream load configuration properties
     * @return the configured metrics instance
     */
    @Bean
    @ConditionalOnMissingBean
    public StreamLoadMetrics streamLoadMetrics(
            MeterRegistry registry,
            MetricsAggregator aggregator,
            StreamLoadProperties properties) {
        return new StreamLoadMetrics(registry, aggregator, properties.toEndpoint().hostTag());
    }
}
