package com.ledgersync.market;

import java.math.BigDecimal;
import java.util.List;

/** Source of daily closing prices, oldest first. */
public interface PriceHistorySource {

    /**
     * Daily closes for the trailing look-back window.
     *
     * @throws com.ledgersync.exception.MarketDataException when the history cannot be fetched
     */
    List<BigDecimal> dailyCloses(String symbol);
}
