package com.cashcow.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer registry for the engine's meters.
 *
 * <p>An in-memory registry is used unless the host application provides its own. Every meter
 * carries the {@code application=cashcow} tag. Meter definitions live in
 * {@link com.cashcow.observability.ForecastMetrics}.
 */
@Configuration
public class MetricsConfig {

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        registry.config().commonTags("application", "cashcow");
        return registry;
    }
}
