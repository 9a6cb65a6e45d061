package com.ledgersync.valuation;

import com.ledgersync.broker.BrokerService;
import com.ledgersync.config.SyncProperties;
import com.ledgersync.domain.model.Position;
import com.ledgersync.domain.model.ValuationResult;
import com.ledgersync.event.ValuationEvent;
import com.ledgersync.exception.BaseException;
import com.ledgersync.exception.MarketDataException;
import com.ledgersync.exception.SyncIterationException;
import com.ledgersync.instrument.SymbolClassifier;
import com.ledgersync.ledger.PositionLedger;
import com.ledgersync.market.MarketDataService;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Refreshes market data on ledger positions: own price, underlying price and underlying
 * volatility, plus the cost basis when {@code ledgersync.sync.update-cost-basis} is on.
 *
 * <p>Each position is valued on its own. A position whose price cannot be fetched is left
 * untouched; a position whose underlying volatility is unavailable still gets its own price
 * and keeps its previous underlying price and volatility. The batch is saved once at the end,
 * unless the worker was interrupted, in which case nothing is saved.
 */
@Service
public class PositionValuationService {

    private static final Logger log = LoggerFactory.getLogger(PositionValuationService.class);

    private final PositionLedger positionLedger;
    private final MarketDataService marketDataService;
    private final BrokerService brokerService;
    private final SyncProperties syncProperties;
    private final ApplicationEventPublisher applicationEventPublisher;

    public PositionValuationService(
            PositionLedger positionLedger,
            MarketDataService marketDataService,
            BrokerService brokerService,
            SyncProperties syncProperties,
            ApplicationEventPublisher applicationEventPublisher) {
        this.positionLedger = positionLedger;
        this.marketDataService = marketDataService;
        this.brokerService = brokerService;
        this.syncProperties = syncProperties;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /** Values every ledger position across all brokers. */
    @Transactional
    public ValuationResult revalueAll(LocalDateTime asOf) {
        return revalue(positionLedger.findAll(), asOf);
    }

    @Transactional
    public ValuationResult revalue(List<Position> positions, LocalDateTime asOf) {
        log.info("Valuation started: {} positions", positions.size());
        Map<String, Optional<Double>> volatilityByUnderlying = new HashMap<>();
        List<Position> valued = new ArrayList<>();
        List<String> failedSymbols = new ArrayList<>();
        int volatilityUpdated = 0;

        for (Position position : positions) {
            abortIfInterrupted(valued.size(), positions.size());
            try {
                if (valuePosition(position, asOf, volatilityByUnderlying)) {
                    volatilityUpdated++;
                }
                valued.add(position);
            } catch (MarketDataException e) {
                failedSymbols.add(position.getSymbol());
                log.error(
                        "Skipping valuation of {} [{}] at {}: {}",
                        position.getSymbol(),
                        position.getStrategy(),
                        position.getBroker(),
                        e.getMessage());
            } catch (RuntimeException e) {
                failedSymbols.add(position.getSymbol());
                log.error(
                        "Unexpected error valuing {} [{}] at {}",
                        position.getSymbol(),
                        position.getStrategy(),
                        position.getBroker(),
                        e);
            }
        }

        abortIfInterrupted(valued.size(), positions.size());
        positionLedger.updateAll(valued);

        ValuationResult result = ValuationResult.builder()
                .asOf(asOf)
                .evaluated(positions.size())
                .priced(valued.size())
                .volatilityUpdated(volatilityUpdated)
                .failedSymbols(failedSymbols)
                .build();
        applicationEventPublisher.publishEvent(new ValuationEvent(this, result));
        log.info(
                "Valuation complete: priced={}/{}, volatilityUpdated={}, failed={}",
                valued.size(),
                positions.size(),
                volatilityUpdated,
                failedSymbols.size());
        return result;
    }

    /**
     * Mutates {@code position} in place. Returns true when the volatility was refreshed.
     *
     * @throws MarketDataException when the position's own price is unavailable; nothing is mutated
     */
    private boolean valuePosition(
            Position position, LocalDateTime asOf, Map<String, Optional<Double>> volatilityByUnderlying) {
        String broker = position.getBroker();
        String symbol = position.getSymbol();
        BigDecimal price = marketDataService.latestPrice(broker, symbol);

        String underlying = SymbolClassifier.extractUnderlying(symbol);
        BigDecimal underlyingPrice = price;
        if (!underlying.equals(symbol)) {
            try {
                underlyingPrice = marketDataService.latestPrice(broker, underlying);
            } catch (MarketDataException e) {
                log.warn("Underlying price unavailable for {} ({}): {}", symbol, underlying, e.getMessage());
                underlyingPrice = null;
            }
        }
        Optional<Double> volatility =
                volatilityByUnderlying.computeIfAbsent(underlying, marketDataService::annualizedVolatility);

        position.setLatestPrice(price);
        position.setLastUpdated(asOf);
        // the underlying price is only refreshed along with the volatility
        if (volatility.isPresent()) {
            position.setUnderlyingVolatility(volatility.get());
            if (underlyingPrice != null) {
                position.setUnderlyingLatestPrice(underlyingPrice);
            }
        }

        if (syncProperties.isUpdateCostBasis()) {
            refreshCostBasis(position);
        }

        log.debug(
                "Valued {} [{}] at {}: price={}, underlying={} @ {}, volatility={}",
                symbol,
                position.getStrategy(),
                broker,
                price,
                underlying,
                position.getUnderlyingLatestPrice(),
                position.getUnderlyingVolatility());
        return volatility.isPresent();
    }

    /** The batch is discarded, not saved, once the worker has been cancelled. */
    private static void abortIfInterrupted(int valued, int total) {
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Valuation interrupted after {} of {} positions; batch not saved", valued, total);
            throw new SyncIterationException("Valuation interrupted after " + valued + " of " + total + " positions");
        }
    }

    private void refreshCostBasis(Position position) {
        try {
            Optional<BigDecimal> costBasis = brokerService.getCostBasis(position.getBroker(), position.getSymbol());
            if (costBasis.isPresent()) {
                position.setCostBasis(costBasis.get());
            } else {
                log.warn("No cost basis reported for {} at {}", position.getSymbol(), position.getBroker());
            }
        } catch (BaseException e) {
            log.warn("Cost basis unavailable for {} at {}: {}", position.getSymbol(), position.getBroker(), e.getMessage());
        }
    }
}
