package com.healthmonitor.engine.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the monitor's meters with the Spring Boot registry.
 *
 * {@link MonitorMetrics} binds the event counters, classifications by
 * source, resolution transitions, sync executions and the event-store and
 * instance-status gauges. Every meter carries an {@code application} tag so
 * the monitor's series can be told apart from the JVM and HTTP ones.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "integration-health-monitor");
    }

    @Bean
    public MonitorMetrics monitorMetrics() {
        return new MonitorMetrics();
    }
}
