package com.ledgersync.entity;

import com.ledgersync.domain.enums.TradeSide;
import com.ledgersync.domain.enums.TradeStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trades table.
 * profit_loss is written once, when the trade is marked filled.
 */
@Entity
@Table(name = "trades")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(length = 50, nullable = false)
    private String broker;

    @Column(length = 64, nullable = false)
    private String symbol;

    @Column(length = 100, nullable = false)
    private String strategy;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private TradeSide side;

    @Column(precision = 20, scale = 8)
    private BigDecimal quantity;

    @Column(name = "executed_price", precision = 20, scale = 6)
    private BigDecimal executedPrice;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(16)")
    private TradeStatus status;

    @Column(name = "profit_loss", precision = 20, scale = 6)
    private BigDecimal profitLoss;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;
}
