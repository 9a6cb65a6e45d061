package com.ledgersync.reconciliation;

import com.ledgersync.broker.BrokerService;
import com.ledgersync.config.SyncProperties;
import com.ledgersync.domain.model.BrokerPosition;
import com.ledgersync.domain.model.Position;
import com.ledgersync.domain.model.PositionInsert;
import com.ledgersync.domain.model.PositionUpdate;
import com.ledgersync.domain.model.ReconciliationDiff;
import com.ledgersync.domain.model.ReconciliationResult;
import com.ledgersync.event.ReconciliationEvent;
import com.ledgersync.ledger.PositionLedger;
import com.ledgersync.market.MarketDataService;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps a broker's ledger rows in line with the broker's live positions.
 *
 * <p>The broker is the source of truth for quantities; the ledger is the source of truth
 * for strategy tags. {@link PositionReconciler} computes the change set and this service
 * writes it in one transaction, then publishes a {@link ReconciliationEvent}. Running it
 * twice against an unchanged broker writes no quantity changes the second time.
 */
@Service
public class PositionReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(PositionReconciliationService.class);

    private final BrokerService brokerService;
    private final PositionLedger positionLedger;
    private final MarketDataService marketDataService;
    private final SyncProperties syncProperties;
    private final ApplicationEventPublisher applicationEventPublisher;

    public PositionReconciliationService(
            BrokerService brokerService,
            PositionLedger positionLedger,
            MarketDataService marketDataService,
            SyncProperties syncProperties,
            ApplicationEventPublisher applicationEventPublisher) {
        this.brokerService = brokerService;
        this.positionLedger = positionLedger;
        this.marketDataService = marketDataService;
        this.syncProperties = syncProperties;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public ReconciliationResult reconcile(String broker) {
        return reconcile(broker, LocalDateTime.now());
    }

    /**
     * Fetches the broker's positions, merges them into the ledger and applies the result.
     *
     * @throws com.ledgersync.exception.BrokerException when the broker positions cannot be fetched;
     *     nothing is written in that case
     */
    @Transactional
    public ReconciliationResult reconcile(String broker, LocalDateTime asOf) {
        long startTime = System.currentTimeMillis();
        log.info("Position reconciliation started: broker={}", broker);

        Map<String, BrokerPosition> brokerPositions = brokerService.getPositions(broker);
        List<Position> ledgerPositions = positionLedger.findByBroker(broker);

        ReconciliationDiff diff = PositionReconciler.reconcileSnapshot(
                brokerPositions, ledgerPositions, syncProperties.isCreateUncategorizedPositions(), asOf);

        int updated = apply(broker, diff, ledgerPositions, brokerPositions, asOf);

        for (String symbol : diff.getUnmanagedSymbols()) {
            log.warn("Broker {} holds {} with no ledger position; assign it to a strategy to track it", broker, symbol);
        }

        ReconciliationResult result = ReconciliationResult.builder()
                .broker(broker)
                .timestamp(asOf)
                .brokerPositionCount(brokerPositions.size())
                .ledgerPositionCount(ledgerPositions.size())
                .deleted(diff.getToDelete().size())
                .updated(updated)
                .inserted(diff.getToInsert().size())
                .unmanagedSymbols(new ArrayList<>(diff.getUnmanagedSymbols()))
                .durationMs(System.currentTimeMillis() - startTime)
                .build();

        applicationEventPublisher.publishEvent(new ReconciliationEvent(this, result));

        if (result.hasChanges()) {
            log.info(
                    "Reconciliation complete: broker={}, deleted={}, updated={}, inserted={}, duration={}ms",
                    broker,
                    result.getDeleted(),
                    result.getUpdated(),
                    result.getInserted(),
                    result.getDurationMs());
        } else {
            log.info("Reconciliation complete: broker={}, no changes, duration={}ms", broker, result.getDurationMs());
        }
        return result;
    }

    /** Writes the diff and returns the number of rows whose quantity changed. */
    private int apply(
            String broker,
            ReconciliationDiff diff,
            List<Position> ledgerPositions,
            Map<String, BrokerPosition> brokerPositions,
            LocalDateTime asOf) {
        for (Position position : diff.getToDelete()) {
            positionLedger.delete(position);
            log.info(
                    "Removed position {} [{}] qty={}: no longer held at {}",
                    position.getSymbol(),
                    position.getStrategy(),
                    position.getQuantity(),
                    broker);
        }

        Map<String, Position> byId =
                ledgerPositions.stream().collect(Collectors.toMap(Position::getId, Function.identity()));
        List<Position> changed = new ArrayList<>();
        int quantityChanges = 0;
        for (PositionUpdate update : diff.getToUpdate()) {
            Position position = byId.get(update.getPositionId());
            position.setQuantity(update.getNewQuantity());
            position.setLastUpdated(update.getLastUpdated());
            changed.add(position);
            if (update.isQuantityChanged()) {
                quantityChanges++;
                log.info(
                        "Position {} [{}] at {}: qty {} -> {}",
                        update.getSymbol(),
                        update.getStrategy(),
                        broker,
                        update.getPreviousQuantity(),
                        update.getNewQuantity());
            }
        }
        positionLedger.updateAll(changed);

        for (PositionInsert insert : diff.getToInsert()) {
            BrokerPosition brokerPosition = brokerPositions.get(insert.getSymbol());
            BigDecimal fallback = brokerPosition != null ? brokerPosition.getMarketPrice() : null;
            BigDecimal price = marketDataService.latestPriceOrElse(broker, insert.getSymbol(), fallback);
            positionLedger.insert(Position.builder()
                    .broker(broker)
                    .symbol(insert.getSymbol())
                    .strategy(Position.UNCATEGORIZED)
                    .quantity(insert.getQuantity())
                    .costBasis(insert.getCostBasis())
                    .latestPrice(price)
                    .openedAt(asOf)
                    .lastUpdated(asOf)
                    .build());
            log.warn(
                    "Discovered {} x {} at {} not assigned to any strategy; recorded as {}",
                    insert.getQuantity(),
                    insert.getSymbol(),
                    broker,
                    Position.UNCATEGORIZED);
        }
        return quantityChanges;
    }
}
