package com.ledgersync.market;

import java.util.Optional;

/** Trailing annualized volatility of a symbol. Empty when it cannot be determined. */
public interface VolatilityOracle {

    Optional<Double> annualizedVolatility(String symbol);
}
