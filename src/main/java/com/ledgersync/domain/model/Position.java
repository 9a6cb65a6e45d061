package com.ledgersync.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A ledger position, unique per (broker, symbol, strategy).
 *
 * <p>Several strategies may hold the same symbol at the same broker independently.
 * The {@value #UNCATEGORIZED} strategy is a catch-all bucket for quantity that exists
 * at the broker but has not been assigned to a tracked strategy yet.
 *
 * <p>Quantity is signed: positive = long, negative = short. Cost basis is the total
 * cost of the position, not a per-share price.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    public static final String UNCATEGORIZED = "uncategorized";

    private String id;
    private String broker;
    private String symbol;
    private String strategy;

    private BigDecimal quantity;
    private BigDecimal latestPrice;
    private BigDecimal costBasis;

    /** Latest price of the underlying; equals the position's own price for equities and futures. */
    private BigDecimal underlyingLatestPrice;

    /** Trailing one-year annualized volatility of the underlying. */
    private Double underlyingVolatility;

    private LocalDateTime openedAt;
    private LocalDateTime lastUpdated;

    public boolean isUncategorized() {
        return UNCATEGORIZED.equals(strategy);
    }

    public boolean isShort() {
        return quantity != null && quantity.signum() < 0;
    }
}
