package com.ledgersync.domain.model;

import com.ledgersync.domain.enums.BalanceType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the append-only balance history. Rows are never updated; the current
 * balance for a (broker, strategy, type) key is its most recent row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Balance {

    private Long id;
    private String broker;
    private String strategy;
    private BalanceType type;
    private BigDecimal amount;
    private LocalDateTime recordedAt;
}
