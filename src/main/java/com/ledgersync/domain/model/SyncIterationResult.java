package com.ledgersync.domain.model;

import com.ledgersync.domain.enums.IterationState;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Outcome of one completed sync iteration. */
@Data
@Builder
public class SyncIterationResult {

    private IterationState state;
    private LocalDateTime startedAt;
    private long durationMs;

    @Builder.Default
    private List<BrokerSyncResult> brokerResults = new ArrayList<>();

    /** Null when the valuation stage failed as a whole. */
    private ValuationResult valuation;

    private String valuationError;

    public long getFailedBrokerCount() {
        return brokerResults.stream().filter(result -> !result.isSuccess()).count();
    }

    public boolean isClean() {
        return getFailedBrokerCount() == 0 && valuationError == null;
    }
}
