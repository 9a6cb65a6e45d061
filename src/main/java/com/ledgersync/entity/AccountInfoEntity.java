package com.ledgersync.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for the account_info table. Keyed by broker name. */
@Entity
@Table(name = "account_info")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountInfoEntity {

    @Id
    @Column(length = 50)
    private String broker;

    @Column(name = "account_value", precision = 20, scale = 6)
    private BigDecimal value;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
