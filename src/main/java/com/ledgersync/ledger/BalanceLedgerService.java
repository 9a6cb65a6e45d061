package com.ledgersync.ledger;

import com.ledgersync.domain.enums.BalanceType;
import com.ledgersync.domain.model.Balance;
import com.ledgersync.domain.model.BalanceSnapshot;
import com.ledgersync.domain.model.Position;
import com.ledgersync.entity.BalanceEntity;
import com.ledgersync.mapper.BalanceMapper;
import com.ledgersync.repository.jpa.BalanceJpaRepository;
import java.math.BigDecimal;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Append-only balance history.
 *
 * <p>Rows are never updated or deleted. The current balance of a (broker, strategy, type)
 * key is its newest row; {@link #currentSnapshot} resolves all keys of a broker at once.
 */
@Service
public class BalanceLedgerService {

    private static final Logger log = LoggerFactory.getLogger(BalanceLedgerService.class);

    private final BalanceJpaRepository balanceJpaRepository;
    private final BalanceMapper balanceMapper = Mappers.getMapper(BalanceMapper.class);

    public BalanceLedgerService(BalanceJpaRepository balanceJpaRepository) {
        this.balanceJpaRepository = balanceJpaRepository;
    }

    public void append(List<Balance> balances) {
        balanceJpaRepository.saveAll(balanceMapper.toEntityList(balances));
        for (Balance balance : balances) {
            log.debug(
                    "Recorded balance {} [{}] {}={} at {}",
                    balance.getBroker(),
                    balance.getStrategy(),
                    balance.getType(),
                    balance.getAmount(),
                    balance.getRecordedAt());
        }
    }

    /** Latest CASH amount for the strategy, ZERO when none was ever recorded. */
    public BigDecimal latestCash(String broker, String strategy) {
        return balanceJpaRepository
                .findFirstByBrokerAndStrategyAndTypeOrderByRecordedAtDescIdDesc(broker, strategy, BalanceType.CASH)
                .map(BalanceEntity::getAmount)
                .orElse(BigDecimal.ZERO);
    }

    public BalanceSnapshot currentSnapshot(String broker) {
        return BalanceSnapshot.of(broker, balanceMapper.toDomainList(balanceJpaRepository.findLatestByBroker(broker)));
    }

    /** Distinct strategies with balance history at the broker, uncategorized excluded. */
    public List<String> findStrategies(String broker) {
        return balanceJpaRepository.findDistinctStrategies(broker, Position.UNCATEGORIZED);
    }
}
