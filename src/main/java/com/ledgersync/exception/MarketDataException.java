package com.ledgersync.exception;

import java.util.Map;

/** A price or volatility lookup failed for a single symbol. */
public class MarketDataException extends BaseException {

    public MarketDataException(String symbol, String message) {
        super(ErrorCode.MARKET_DATA_ERROR, message, Map.of("symbol", symbol));
    }

    public MarketDataException(String symbol, String message, Throwable cause) {
        super(ErrorCode.MARKET_DATA_ERROR, message, Map.of("symbol", symbol), cause);
    }
}
