package com.ledgersync.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.ledgersync.domain.enums.IterationState;
import com.ledgersync.domain.model.BrokerSyncResult;
import com.ledgersync.domain.model.ReconciliationResult;
import com.ledgersync.domain.model.SyncIterationResult;
import com.ledgersync.domain.model.ValuationResult;
import com.ledgersync.event.ReconciliationEvent;
import com.ledgersync.event.SyncIterationEvent;
import com.ledgersync.event.ValuationEvent;
import com.ledgersync.observability.SyncMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SyncMetricsServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private SyncMetricsService syncMetricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        syncMetricsService = new SyncMetricsService(meterRegistry);
    }

    @Test
    @DisplayName("Iterations are counted by outcome and timed")
    void iterations() {
        SyncIterationResult result = SyncIterationResult.builder()
                .state(IterationState.COMPLETED)
                .brokerResults(List.of(
                        BrokerSyncResult.builder().broker("a").success(false).build(),
                        BrokerSyncResult.builder().broker("b").success(true).build()))
                .build();

        syncMetricsService.onSyncIterationEvent(new SyncIterationEvent(this, IterationState.COMPLETED, 1500, result));
        syncMetricsService.onSyncIterationEvent(new SyncIterationEvent(this, IterationState.TIMED_OUT, 120_000, null));

        assertThat(meterRegistry.get("sync.iterations").tag("outcome", "completed").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("sync.iterations").tag("outcome", "timed_out").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("sync.iterations").tag("outcome", "failed").counter().count()).isZero();
        assertThat(meterRegistry.get("sync.broker.failures").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("sync.iteration.duration").timer().count()).isEqualTo(2);
        assertThat(meterRegistry.get("sync.iteration.duration").timer().totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(121_500.0);
    }

    @Test
    @DisplayName("Reconciliation changes are counted by kind")
    void reconciliationChanges() {
        ReconciliationResult result = ReconciliationResult.builder().broker("a").deleted(1).updated(2).inserted(3).build();

        syncMetricsService.onReconciliationEvent(new ReconciliationEvent(this, result));

        assertThat(meterRegistry.get("reconciliation.changes").tag("kind", "delete").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("reconciliation.changes").tag("kind", "update").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("reconciliation.changes").tag("kind", "insert").counter().count()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Unpriced positions are counted as valuation failures")
    void valuationFailures() {
        ValuationResult result = ValuationResult.builder().failedSymbols(List.of("ZZZ", "YYY")).build();

        syncMetricsService.onValuationEvent(new ValuationEvent(this, result));

        assertThat(meterRegistry.get("valuation.failures").counter().count()).isEqualTo(2.0);
    }
}
