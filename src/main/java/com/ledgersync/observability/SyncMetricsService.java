package com.ledgersync.observability;

import com.ledgersync.domain.enums.ChangeKind;
import com.ledgersync.domain.enums.IterationState;
import com.ledgersync.domain.model.ReconciliationResult;
import com.ledgersync.domain.model.SyncIterationResult;
import com.ledgersync.event.ReconciliationEvent;
import com.ledgersync.event.SyncIterationEvent;
import com.ledgersync.event.ValuationEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the sync loop, updated from application events:
 * <ul>
 *   <li><b>sync.iterations</b> (counter, tag outcome): finished iterations by end state</li>
 *   <li><b>sync.iteration.duration</b> (timer): wall time per iteration</li>
 *   <li><b>sync.broker.failures</b> (counter): brokers whose reconcile/balance stage failed</li>
 *   <li><b>reconciliation.changes</b> (counter, tag kind): ledger rows deleted, updated, inserted</li>
 *   <li><b>valuation.failures</b> (counter): positions that could not be priced</li>
 * </ul>
 */
@Service
public class SyncMetricsService {

    private final Map<IterationState, Counter> iterationCounters = new EnumMap<>(IterationState.class);
    private final Map<ChangeKind, Counter> changeCounters = new EnumMap<>(ChangeKind.class);
    private final Timer iterationTimer;
    private final Counter brokerFailureCounter;
    private final Counter valuationFailureCounter;

    public SyncMetricsService(MeterRegistry meterRegistry) {
        for (IterationState state :
                new IterationState[] {IterationState.COMPLETED, IterationState.TIMED_OUT, IterationState.FAILED}) {
            iterationCounters.put(
                    state,
                    Counter.builder("sync.iterations")
                            .description("Finished sync iterations by outcome")
                            .tag("outcome", state.name().toLowerCase(Locale.ROOT))
                            .register(meterRegistry));
        }
        for (ChangeKind kind : ChangeKind.values()) {
            changeCounters.put(
                    kind,
                    Counter.builder("reconciliation.changes")
                            .description("Ledger position rows changed by reconciliation")
                            .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                            .register(meterRegistry));
        }

        this.iterationTimer = Timer.builder("sync.iteration.duration")
                .description("Wall time of one sync iteration")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);

        this.brokerFailureCounter = Counter.builder("sync.broker.failures")
                .description("Brokers whose reconcile or balance stage failed")
                .register(meterRegistry);

        this.valuationFailureCounter = Counter.builder("valuation.failures")
                .description("Positions that could not be priced during valuation")
                .register(meterRegistry);
    }

    @EventListener
    public void onSyncIterationEvent(SyncIterationEvent event) {
        Counter counter = iterationCounters.get(event.getState());
        if (counter != null) {
            counter.increment();
        }
        iterationTimer.record(event.getDurationMs(), TimeUnit.MILLISECONDS);
        SyncIterationResult result = event.getResult();
        if (result != null) {
            brokerFailureCounter.increment(result.getFailedBrokerCount());
        }
    }

    @EventListener
    public void onReconciliationEvent(ReconciliationEvent event) {
        ReconciliationResult result = event.getResult();
        changeCounters.get(ChangeKind.DELETE).increment(result.getDeleted());
        changeCounters.get(ChangeKind.UPDATE).increment(result.getUpdated());
        changeCounters.get(ChangeKind.INSERT).increment(result.getInserted());
    }

    @EventListener
    public void onValuationEvent(ValuationEvent event) {
        valuationFailureCounter.increment(event.getResult().getFailedSymbols().size());
    }
}
