package com.ledgersync.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Derived cash / positions / total figures for one strategy at one timestamp. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyBalance {

    private String strategy;
    private BigDecimal cash;
    private BigDecimal positions;

    public BigDecimal getTotal() {
        return cash.add(positions);
    }
}
