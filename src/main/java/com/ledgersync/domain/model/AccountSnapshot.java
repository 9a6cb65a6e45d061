package com.ledgersync.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Account-level figures reported by a broker. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountSnapshot {

    /** Total account value (cash + market value of all positions). */
    private BigDecimal value;

    /** Settled cash, when the broker reports it separately. */
    private BigDecimal cash;
}
