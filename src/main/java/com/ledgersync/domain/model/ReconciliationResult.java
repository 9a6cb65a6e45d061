package com.ledgersync.domain.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of reconciling one broker's ledger rows against its live positions.
 * Counts only the changes actually written; unchanged rows are not counted as updates.
 */
@Data
@Builder
public class ReconciliationResult {

    private String broker;
    private LocalDateTime timestamp;

    private int brokerPositionCount;
    private int ledgerPositionCount;

    private int deleted;
    private int updated;
    private int inserted;

    @Builder.Default
    private List<String> unmanagedSymbols = new ArrayList<>();

    private long durationMs;

    public boolean hasChanges() {
        return deleted + updated + inserted > 0;
    }
}
