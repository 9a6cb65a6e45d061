package com.ledgersync.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the common tags applied to every metric. The sync metric definitions live in
 * {@link com.ledgersync.observability.SyncMetricsService}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    public MetricsConfig(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "ledgersync");
    }
}
