package com.ledgersync.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Last known account value per broker. One row per broker, overwritten on every update. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountInfo {

    private String broker;
    private BigDecimal value;
    private LocalDateTime updatedAt;
}
