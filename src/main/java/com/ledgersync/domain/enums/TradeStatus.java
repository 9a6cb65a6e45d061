package com.ledgersync.domain.enums;

/**
 * Trade lifecycle. Trades are created OPEN by the execution layer and move to
 * FILLED or CANCELLED exactly once.
 */
public enum TradeStatus {
    OPEN,
    FILLED,
    CANCELLED;

    public boolean isTerminal() {
        return this != OPEN;
    }
}
