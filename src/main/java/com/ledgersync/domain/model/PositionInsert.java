package com.ledgersync.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * New uncategorized ledger row for broker quantity that no strategy accounts for.
 * The latest price is fetched from the broker when the row is written.
 */
@Data
@Builder
public class PositionInsert {

    private String symbol;
    private BigDecimal quantity;
    private BigDecimal costBasis;
}
