package com.ledgersync.config;

import jakarta.validation.constraints.Min;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Broker call settings, bound to {@code ledgersync.broker.*}. */
@ConfigurationProperties(prefix = "ledgersync.broker")
@Validated
@Getter
@Setter
public class BrokerProperties {

    /** Upper bound for awaiting a single broker call. */
    @Min(1)
    private long callTimeoutSeconds = 30;

    public Duration getCallTimeout() {
        return Duration.ofSeconds(callTimeoutSeconds);
    }
}
