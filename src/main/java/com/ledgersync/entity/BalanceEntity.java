package com.ledgersync.entity;

import com.ledgersync.domain.enums.BalanceType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the balances table.
 * Append-only: every derivation cycle inserts new rows and old rows are kept as history.
 * The identity id breaks ties between rows recorded at the same timestamp.
 */
@Entity
@Table(
        name = "balances",
        indexes = @Index(name = "idx_balances_key", columnList = "broker, strategy, balance_type, recorded_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BalanceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 50, nullable = false)
    private String broker;

    @Column(length = 100, nullable = false)
    private String strategy;

    @Enumerated(EnumType.STRING)
    @Column(name = "balance_type", columnDefinition = "varchar(16)", nullable = false)
    private BalanceType type;

    @Column(precision = 20, scale = 6, nullable = false)
    private BigDecimal amount;

    @Column(name = "recorded_at", nullable = false)
    private LocalDateTime recordedAt;
}
