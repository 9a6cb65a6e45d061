package com.ledgersync.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the positions table.
 * One row per (broker, symbol, strategy); the ledger's source of truth for holdings.
 */
@Entity
@Table(
        name = "positions",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_positions_broker_symbol_strategy",
                columnNames = {"broker", "symbol", "strategy"}),
        indexes = @Index(name = "idx_positions_broker", columnList = "broker"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(length = 50, nullable = false)
    private String broker;

    @Column(length = 64, nullable = false)
    private String symbol;

    @Column(length = 100, nullable = false)
    private String strategy;

    @Column(precision = 20, scale = 8)
    private BigDecimal quantity;

    @Column(name = "latest_price", precision = 20, scale = 6)
    private BigDecimal latestPrice;

    @Column(name = "cost_basis", precision = 20, scale = 6)
    private BigDecimal costBasis;

    @Column(name = "underlying_latest_price", precision = 20, scale = 6)
    private BigDecimal underlyingLatestPrice;

    @Column(name = "underlying_volatility")
    private Double underlyingVolatility;

    @Column(name = "opened_at")
    private LocalDateTime openedAt;

    @Column(name = "last_updated")
    private LocalDateTime lastUpdated;
}
