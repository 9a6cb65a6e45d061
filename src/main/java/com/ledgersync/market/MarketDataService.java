package com.ledgersync.market;

import com.ledgersync.broker.BrokerService;
import com.ledgersync.exception.BrokerException;
import com.ledgersync.exception.MarketDataException;
import java.math.BigDecimal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Price and volatility lookups used by valuation and balance derivation.
 * Prices always come from the position's own broker.
 */
@Service
public class MarketDataService {

    private static final Logger log = LoggerFactory.getLogger(MarketDataService.class);

    private final BrokerService brokerService;
    private final VolatilityOracle volatilityOracle;

    public MarketDataService(BrokerService brokerService, VolatilityOracle volatilityOracle) {
        this.brokerService = brokerService;
        this.volatilityOracle = volatilityOracle;
    }

    /**
     * @throws MarketDataException when the broker cannot price the symbol
     */
    public BigDecimal latestPrice(String broker, String symbol) {
        try {
            return brokerService.getLatestPrice(broker, symbol);
        } catch (BrokerException e) {
            throw new MarketDataException(symbol, "No price for " + symbol + " at " + broker + ": " + e.getMessage(), e);
        }
    }

    /** Latest price, or {@code fallback} when the broker cannot price the symbol. */
    public BigDecimal latestPriceOrElse(String broker, String symbol, BigDecimal fallback) {
        try {
            return latestPrice(broker, symbol);
        } catch (MarketDataException e) {
            log.warn("Using fallback price {} for {} at {}: {}", fallback, symbol, broker, e.getMessage());
            return fallback;
        }
    }

    public Optional<Double> annualizedVolatility(String symbol) {
        return volatilityOracle.annualizedVolatility(symbol);
    }
}
