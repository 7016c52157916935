package com.strategylab.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with the application name. The batch meters themselves are defined
 * in {@link com.strategylab.observability.BatchMetricsService}.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> applicationTagCustomizer(
            @Value("${spring.application.name:strategylab}") String applicationName) {
        return registry -> registry.config().commonTags("application", applicationName);
    }
}
