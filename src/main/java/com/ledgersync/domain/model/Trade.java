package com.ledgersync.domain.model;

import com.ledgersync.domain.enums.TradeSide;
import com.ledgersync.domain.enums.TradeStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An executed (or pending) trade against a strategy's position.
 *
 * <p>profitLoss is computed once when the trade is filled and never recomputed. It stays
 * null for buy-to-open trades and whenever the realized P/L could not be determined.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trade {

    private String id;
    private String broker;
    private String symbol;
    private String strategy;
    private TradeSide side;
    private BigDecimal quantity;
    private BigDecimal executedPrice;
    private TradeStatus status;
    private BigDecimal profitLoss;
    private LocalDateTime createdAt;
    private LocalDateTime closedAt;
}
