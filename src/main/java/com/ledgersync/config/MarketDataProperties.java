package com.ledgersync.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Historical price source and volatility settings, bound to {@code ledgersync.market.*}. */
@ConfigurationProperties(prefix = "ledgersync.market")
@Validated
@Getter
@Setter
public class MarketDataProperties {

    /** When false, volatility is never computed and positions keep their previous values. */
    private boolean historyEnabled = true;

    /** Base URL of the chart API serving daily closes. */
    @NotBlank
    private String historyBaseUrl = "https://query1.finance.yahoo.com";

    /** Look-back window requested from the chart API. */
    @NotBlank
    private String historyRange = "1y";

    /** Annualization factor applied to the daily return standard deviation. */
    @Min(1)
    private int tradingDaysPerYear = 252;

    /** Fewer daily returns than this and the volatility is reported as unavailable. */
    @Min(2)
    private int minObservations = 20;

    /** HTTP connect timeout in milliseconds. */
    private int connectTimeout = 5000;

    /** HTTP read timeout in milliseconds. */
    private int readTimeout = 15000;
}
