package com.ledgersync.sync;

import com.ledgersync.balance.BalanceDerivationService;
import com.ledgersync.config.SyncProperties;
import com.ledgersync.domain.enums.IterationState;
import com.ledgersync.domain.model.BrokerBalanceResult;
import com.ledgersync.domain.model.BrokerSyncResult;
import com.ledgersync.domain.model.ReconciliationResult;
import com.ledgersync.domain.model.SyncIterationResult;
import com.ledgersync.domain.model.ValuationResult;
import com.ledgersync.event.SyncIterationEvent;
import com.ledgersync.exception.BaseException;
import com.ledgersync.exception.ErrorCode;
import com.ledgersync.exception.SyncIterationException;
import com.ledgersync.exception.SyncTimeoutException;
import com.ledgersync.reconciliation.PositionReconciliationService;
import com.ledgersync.valuation.PositionValuationService;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs one bounded sync iteration across brokers.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>per broker, in its own transaction: reconcile positions (when enabled), then derive
 *       balances. A broker that fails with a non-fatal {@link ErrorCode} is reported in its
 *       {@link BrokerSyncResult}; the next broker still runs. A fatal code ends the iteration;</li>
 *   <li>revalue every ledger position, in its own transaction.</li>
 * </ol>
 *
 * <p>The iteration runs on the single-threaded {@code syncExecutor} and the caller waits at
 * most {@code timeout}. The deadline is also checked before every stage, so once it has
 * passed no further stage starts. On expiry the worker is interrupted, committed stages stand,
 * the in-flight stage rolls back, and {@link SyncTimeoutException} is thrown. Only one
 * iteration runs at a time.
 *
 * <p>State machine: IDLE -> RUNNING -> COMPLETED | TIMED_OUT | FAILED.
 */
@Service
public class SyncOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final PositionReconciliationService positionReconciliationService;
    private final BalanceDerivationService balanceDerivationService;
    private final PositionValuationService positionValuationService;
    private final SyncProperties syncProperties;
    private final TransactionTemplate transactionTemplate;
    private final AsyncTaskExecutor syncExecutor;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final AtomicReference<IterationState> state = new AtomicReference<>(IterationState.IDLE);

    public SyncOrchestrator(
            PositionReconciliationService positionReconciliationService,
            BalanceDerivationService balanceDerivationService,
            PositionValuationService positionValuationService,
            SyncProperties syncProperties,
            PlatformTransactionManager transactionManager,
            @Qualifier("syncExecutor") AsyncTaskExecutor syncExecutor,
            ApplicationEventPublisher applicationEventPublisher) {
        this.positionReconciliationService = positionReconciliationService;
        this.balanceDerivationService = balanceDerivationService;
        this.positionValuationService = positionValuationService;
        this.syncProperties = syncProperties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.syncExecutor = syncExecutor;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public IterationState getState() {
        return state.get();
    }

    /**
     * @throws SyncTimeoutException when the iteration does not finish within {@code timeout}
     * @throws SyncIterationException when an iteration is already running or the iteration
     *     fails outside the per-broker and valuation stages
     */
    public SyncIterationResult runIteration(List<String> brokers, Duration timeout) {
        IterationState current = state.get();
        if (!current.acceptsNewIteration() || !state.compareAndSet(current, IterationState.RUNNING)) {
            throw new SyncIterationException("A sync iteration is already running");
        }

        long startTime = System.currentTimeMillis();
        LocalDateTime startedAt = LocalDateTime.now();
        Instant deadline = Instant.now().plus(timeout);
        log.info("Sync iteration started: brokers={}, timeout={}s", brokers, timeout.toSeconds());

        Future<SyncIterationResult> future;
        try {
            future = syncExecutor.submit(() -> execute(brokers, startedAt, deadline, timeout));
        } catch (TaskRejectedException e) {
            finish(IterationState.FAILED, startTime, null);
            throw new SyncIterationException("Sync worker is still busy with a previous iteration", e);
        }

        try {
            SyncIterationResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            result.setDurationMs(System.currentTimeMillis() - startTime);
            finish(IterationState.COMPLETED, startTime, result);
            log.info(
                    "Sync iteration complete: duration={}ms, failedBrokers={}, valuationError={}",
                    result.getDurationMs(),
                    result.getFailedBrokerCount(),
                    result.getValuationError());
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            finish(IterationState.TIMED_OUT, startTime, null);
            log.error("Sync iteration exceeded {}s; in-flight work cancelled", timeout.toSeconds());
            throw new SyncTimeoutException(timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            finish(IterationState.FAILED, startTime, null);
            throw new SyncIterationException("Interrupted while waiting for the sync iteration", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof SyncTimeoutException timeoutException) {
                finish(IterationState.TIMED_OUT, startTime, null);
                log.error("Sync iteration stopped at its deadline: {}", cause.getMessage());
                throw timeoutException;
            }
            finish(IterationState.FAILED, startTime, null);
            log.error("Sync iteration failed", cause);
            throw new SyncIterationException("Sync iteration failed: " + cause.getMessage(), cause);
        }
    }

    private SyncIterationResult execute(
            List<String> brokers, LocalDateTime asOf, Instant deadline, Duration timeout) {
        List<BrokerSyncResult> brokerResults = new ArrayList<>();
        for (String broker : brokers) {
            checkDeadline(deadline, timeout);
            brokerResults.add(syncBroker(broker, asOf, timeout));
        }

        checkDeadline(deadline, timeout);
        ValuationResult valuation = null;
        String valuationError = null;
        try {
            valuation = transactionTemplate.execute(status -> {
                ValuationResult valued = positionValuationService.revalueAll(asOf);
                rollBackIfInterrupted(timeout);
                return valued;
            });
        } catch (RuntimeException e) {
            if (BaseException.isFatal(e)) {
                throw e;
            }
            valuationError = e.getMessage();
            log.error("Valuation stage failed [{}]", errorCode(e), e);
        }
        checkDeadline(deadline, timeout);

        return SyncIterationResult.builder()
                .state(IterationState.COMPLETED)
                .startedAt(asOf)
                .brokerResults(brokerResults)
                .valuation(valuation)
                .valuationError(valuationError)
                .build();
    }

    private BrokerSyncResult syncBroker(String broker, LocalDateTime asOf, Duration timeout) {
        try {
            return transactionTemplate.execute(status -> {
                ReconciliationResult reconciliation = null;
                if (syncProperties.isReconcilePositions()) {
                    reconciliation = positionReconciliationService.reconcile(broker, asOf);
                }
                BrokerBalanceResult balances = balanceDerivationService.deriveBalances(broker, asOf);
                rollBackIfInterrupted(timeout);
                return BrokerSyncResult.builder()
                        .broker(broker)
                        .success(true)
                        .reconciliation(reconciliation)
                        .balances(balances)
                        .build();
            });
        } catch (RuntimeException e) {
            if (BaseException.isFatal(e)) {
                throw e;
            }
            String code = errorCode(e);
            Map<String, Object> details =
                    e instanceof BaseException baseException ? baseException.getDetails() : Map.of();
            log.error("Sync failed for broker {} [{}] {}; changes for this broker rolled back", broker, code, details, e);
            return BrokerSyncResult.builder()
                    .broker(broker)
                    .success(false)
                    .error(e.getMessage())
                    .errorCode(code)
                    .build();
        }
    }

    /** A stage that finished after its deadline fired must not commit. */
    private static void rollBackIfInterrupted(Duration timeout) {
        if (Thread.currentThread().isInterrupted()) {
            throw new SyncTimeoutException(timeout);
        }
    }

    private static String errorCode(Throwable throwable) {
        ErrorCode code = throwable instanceof BaseException baseException
                ? baseException.getErrorCode()
                : ErrorCode.INTERNAL_ERROR;
        return code.getCode();
    }

    private static void checkDeadline(Instant deadline, Duration timeout) {
        if (Thread.currentThread().isInterrupted() || Instant.now().isAfter(deadline)) {
            throw new SyncTimeoutException(timeout);
        }
    }

    private void finish(IterationState outcome, long startTime, SyncIterationResult result) {
        state.set(outcome);
        if (result != null) {
            result.setState(outcome);
        }
        applicationEventPublisher.publishEvent(
                new SyncIterationEvent(this, outcome, System.currentTimeMillis() - startTime, result));
    }
}
