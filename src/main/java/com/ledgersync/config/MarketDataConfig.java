package com.ledgersync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgersync.market.HistoricalVolatilityOracle;
import com.ledgersync.market.PriceHistorySource;
import com.ledgersync.market.RestPriceHistorySource;
import com.ledgersync.market.VolatilityOracle;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the historical price source and the volatility oracle built on it. */
@Configuration
public class MarketDataConfig {

    private static final Logger log = LoggerFactory.getLogger(MarketDataConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public PriceHistorySource priceHistorySource(MarketDataProperties properties, ObjectMapper objectMapper) {
        return new RestPriceHistorySource(properties, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public VolatilityOracle volatilityOracle(MarketDataProperties properties, PriceHistorySource priceHistorySource) {
        if (!properties.isHistoryEnabled()) {
            log.info("Historical volatility disabled; positions keep their previous volatility");
            return symbol -> Optional.empty();
        }
        return new HistoricalVolatilityOracle(
                priceHistorySource, properties.getTradingDaysPerYear(), properties.getMinObservations());
    }
}
