package com.ledgersync.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A position as reported by a broker. Read-only input to reconciliation: the broker
 * knows nothing about strategies, only symbols and quantities.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrokerPosition {

    private String symbol;

    /** Signed quantity held at the broker. */
    private BigDecimal quantity;

    /** Total cost of the position, when the broker reports it. */
    private BigDecimal costBasis;

    /** Mark price at snapshot time, when the broker reports it. */
    private BigDecimal marketPrice;
}
