package com.ledgersync.event;

import com.ledgersync.domain.model.ReconciliationResult;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a broker's reconciliation diff has been applied to the ledger.
 *
 * <p>Listeners: SyncMetricsService counts the applied changes by kind.
 */
public class ReconciliationEvent extends ApplicationEvent {

    private final ReconciliationResult result;
    private final LocalDateTime reconciledAt;

    public ReconciliationEvent(Object source, ReconciliationResult result) {
        super(source);
        this.result = result;
        this.reconciledAt = LocalDateTime.now();
    }

    public ReconciliationResult getResult() {
        return result;
    }

    public LocalDateTime getReconciledAt() {
        return reconciledAt;
    }
}
