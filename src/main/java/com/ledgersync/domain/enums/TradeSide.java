package com.ledgersync.domain.enums;

/** Buy or sell side of a trade. */
public enum TradeSide {
    BUY,
    SELL
}
