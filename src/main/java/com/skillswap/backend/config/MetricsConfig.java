package com.skillswap.backend.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Metrics configuration for Prometheus monitoring
 */
@Slf4j
@Configuration
public class MetricsConfig {

    /**
     * Common tags added to every metric published
     */
    @Bean
    public List<Tag> commonTags() {
        return List.of(
            Tag.of("service", "skill-swap"),
            Tag.of("component", "backend")
        );
    }

    /**
     * Applied when the registry is created, before any service registers a meter
     */
    @Bean
    public MeterRegistryCustomizer<MeterRegistry> commonTagsCustomizer(List<Tag> commonTags) {
        return registry -> {
            registry.config().commonTags(commonTags);
            log.info("Registered common metric tags: {}", commonTags);
        };
    }
}
