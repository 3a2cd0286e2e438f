package com.bondyield.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with {@code application=<spring.application.name>} so the calculator's
 * {@code bond.*} meters and the auto-configured JVM/HTTP meters share one dimension.
 *
 * <p>Applied through a registry customizer, which runs before any meter is registered, so
 * the meters created by {@link com.bondyield.observability.CalculationMetricsService} carry the tag too.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> applicationTag(
            @Value("${spring.application.name:bond-yield-calculator}") String applicationName) {
        return registry -> registry.config().commonTags("application", applicationName);
    }
}
