package com.ledgersync.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Balances derived for one broker in one cycle: one entry per real strategy plus the
 * uncategorized residual that reconciles the books with the broker's account value.
 */
@Data
@Builder
public class BrokerBalanceResult {

    private String broker;
    private LocalDateTime asOf;

    @Builder.Default
    private List<StrategyBalance> strategies = new ArrayList<>();

    private StrategyBalance uncategorized;

    private BigDecimal accountValue;

    /** Sum of the TOTAL rows current before this cycle's rows were appended. */
    private BigDecimal previousAccountTotal;

    private BigDecimal categorizedSum;
}
