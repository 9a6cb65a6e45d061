package com.ledgersync.domain.enums;

/** Kind of balance row appended to the balance history. TOTAL is always CASH + POSITIONS. */
public enum BalanceType {
    CASH,
    POSITIONS,
    TOTAL
}
