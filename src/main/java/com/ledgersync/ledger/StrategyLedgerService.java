package com.ledgersync.ledger;

import com.ledgersync.domain.model.Position;
import com.ledgersync.domain.model.StrategyRenameResult;
import com.ledgersync.entity.PositionEntity;
import com.ledgersync.exception.BusinessException;
import com.ledgersync.repository.jpa.BalanceJpaRepository;
import com.ledgersync.repository.jpa.PositionJpaRepository;
import com.ledgersync.repository.jpa.TradeJpaRepository;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Strategy-level maintenance across positions, balances and trades. */
@Service
public class StrategyLedgerService {

    private static final Logger log = LoggerFactory.getLogger(StrategyLedgerService.class);

    private final PositionJpaRepository positionJpaRepository;
    private final BalanceJpaRepository balanceJpaRepository;
    private final TradeJpaRepository tradeJpaRepository;

    public StrategyLedgerService(
            PositionJpaRepository positionJpaRepository,
            BalanceJpaRepository balanceJpaRepository,
            TradeJpaRepository tradeJpaRepository) {
        this.positionJpaRepository = positionJpaRepository;
        this.balanceJpaRepository = balanceJpaRepository;
        this.tradeJpaRepository = tradeJpaRepository;
    }

    /**
     * Retags every position, balance row and trade of {@code oldStrategy} at the broker.
     *
     * <p>Refuses to rename to or from the uncategorized bucket, and refuses when the target
     * strategy already holds one of the symbols (positions are unique per broker, symbol
     * and strategy).
     */
    @Transactional
    public StrategyRenameResult renameStrategy(String broker, String oldStrategy, String newStrategy) {
        if (oldStrategy == null || newStrategy == null || newStrategy.isBlank()) {
            throw new BusinessException("Strategy names must not be blank");
        }
        if (Position.UNCATEGORIZED.equals(oldStrategy) || Position.UNCATEGORIZED.equals(newStrategy)) {
            throw new BusinessException("The " + Position.UNCATEGORIZED + " strategy cannot be renamed");
        }
        if (oldStrategy.equals(newStrategy)) {
            return StrategyRenameResult.builder()
                    .broker(broker)
                    .oldStrategy(oldStrategy)
                    .newStrategy(newStrategy)
                    .build();
        }

        Set<String> targetSymbols = positionJpaRepository.findByBrokerAndStrategy(broker, newStrategy).stream()
                .map(PositionEntity::getSymbol)
                .collect(Collectors.toSet());
        List<String> clashes = positionJpaRepository.findByBrokerAndStrategy(broker, oldStrategy).stream()
                .map(PositionEntity::getSymbol)
                .filter(targetSymbols::contains)
                .toList();
        if (!clashes.isEmpty()) {
            throw new BusinessException(
                    "Strategy " + newStrategy + " already holds " + clashes + " at " + broker,
                    Map.of("broker", broker, "symbols", clashes));
        }

        int positions = positionJpaRepository.renameStrategy(broker, oldStrategy, newStrategy);
        int balances = balanceJpaRepository.renameStrategy(broker, oldStrategy, newStrategy);
        int trades = tradeJpaRepository.renameStrategy(broker, oldStrategy, newStrategy);
        log.info(
                "Renamed strategy {} -> {} at {}: positions={}, balances={}, trades={}",
                oldStrategy,
                newStrategy,
                broker,
                positions,
                balances,
                trades);

        return StrategyRenameResult.builder()
                .broker(broker)
                .oldStrategy(oldStrategy)
                .newStrategy(newStrategy)
                .positions(positions)
                .balances(balances)
                .trades(trades)
                .build();
    }
}
