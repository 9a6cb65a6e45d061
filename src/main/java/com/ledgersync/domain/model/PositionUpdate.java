package com.ledgersync.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/** Quantity change for an existing ledger row, produced by reconciliation. */
@Data
@Builder
public class PositionUpdate {

    private String positionId;
    private String symbol;
    private String strategy;
    private BigDecimal previousQuantity;
    private BigDecimal newQuantity;
    private LocalDateTime lastUpdated;

    public boolean isQuantityChanged() {
        if (previousQuantity == null || newQuantity == null) {
            return previousQuantity != newQuantity;
        }
        return previousQuantity.compareTo(newQuantity) != 0;
    }
}
