package com.ledgersync.market;

import com.ledgersync.exception.MarketDataException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Close-to-close historical volatility: sample standard deviation of daily percentage
 * returns, scaled by the square root of trading days per year.
 */
public class HistoricalVolatilityOracle implements VolatilityOracle {

    private static final Logger log = LoggerFactory.getLogger(HistoricalVolatilityOracle.class);

    private final PriceHistorySource priceHistorySource;
    private final int tradingDaysPerYear;
    private final int minObservations;

    public HistoricalVolatilityOracle(PriceHistorySource priceHistorySource, int tradingDaysPerYear, int minObservations) {
        this.priceHistorySource = priceHistorySource;
        this.tradingDaysPerYear = tradingDaysPerYear;
        this.minObservations = minObservations;
    }

    @Override
    public Optional<Double> annualizedVolatility(String symbol) {
        List<BigDecimal> closes;
        try {
            closes = priceHistorySource.dailyCloses(symbol);
        } catch (MarketDataException e) {
            log.warn("Volatility unavailable for {}: {}", symbol, e.getMessage());
            return Optional.empty();
        }

        List<Double> returns = dailyReturns(closes);
        if (returns.size() < minObservations) {
            log.warn("Volatility unavailable for {}: {} returns, need {}", symbol, returns.size(), minObservations);
            return Optional.empty();
        }
        double volatility = sampleStandardDeviation(returns) * Math.sqrt(tradingDaysPerYear);
        if (Double.isNaN(volatility)) {
            log.warn("Volatility unavailable for {}: returns are not finite", symbol);
            return Optional.empty();
        }
        log.debug("Annualized volatility for {}: {}", symbol, volatility);
        return Optional.of(volatility);
    }

    /** Percentage change between consecutive closes. A zero close breaks the series and is skipped. */
    public static List<Double> dailyReturns(List<BigDecimal> closes) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < closes.size(); i++) {
            BigDecimal previous = closes.get(i - 1);
            if (previous.signum() == 0) {
                continue;
            }
            returns.add(closes.get(i).subtract(previous).divide(previous, MathContext.DECIMAL64).doubleValue());
        }
        return returns;
    }

    /** Bias-corrected (n - 1) standard deviation; NaN for an empty series. */
    public static double sampleStandardDeviation(List<Double> values) {
        DescriptiveStatistics statistics = new DescriptiveStatistics();
        values.forEach(statistics::addValue);
        return statistics.getStandardDeviation();
    }
}
