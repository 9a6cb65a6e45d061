package com.ledgersync.balance;

import com.ledgersync.broker.BrokerService;
import com.ledgersync.domain.enums.BalanceType;
import com.ledgersync.domain.model.AccountSnapshot;
import com.ledgersync.domain.model.Balance;
import com.ledgersync.domain.model.BrokerBalanceResult;
import com.ledgersync.domain.model.Position;
import com.ledgersync.domain.model.StrategyBalance;
import com.ledgersync.ledger.AccountInfoService;
import com.ledgersync.ledger.BalanceLedgerService;
import com.ledgersync.ledger.PositionLedger;
import com.ledgersync.market.MarketDataService;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Derives per-strategy balances for one broker and appends them to the balance history.
 *
 * <p>Bottom-up, each strategy's total is its latest recorded cash plus the market value of
 * its positions. Top-down, whatever part of the broker's account value the strategies do
 * not explain is booked to {@value Position#UNCATEGORIZED} as CASH, so the TOTAL rows of one
 * cycle always add up to the account value (unless the strategies already exceed it, in which
 * case the residual is zero). Uncategorized POSITIONS is always zero: the value of unassigned
 * holdings is already inside the residual.
 */
@Service
public class BalanceDerivationService {

    private static final Logger log = LoggerFactory.getLogger(BalanceDerivationService.class);

    private final PositionLedger positionLedger;
    private final BalanceLedgerService balanceLedgerService;
    private final AccountInfoService accountInfoService;
    private final MarketDataService marketDataService;
    private final BrokerService brokerService;

    public BalanceDerivationService(
            PositionLedger positionLedger,
            BalanceLedgerService balanceLedgerService,
            AccountInfoService accountInfoService,
            MarketDataService marketDataService,
            BrokerService brokerService) {
        this.positionLedger = positionLedger;
        this.balanceLedgerService = balanceLedgerService;
        this.accountInfoService = accountInfoService;
        this.marketDataService = marketDataService;
        this.brokerService = brokerService;
    }

    /**
     * @throws com.ledgersync.exception.BrokerException when the account value cannot be fetched;
     *     no rows are written in that case
     */
    @Transactional
    public BrokerBalanceResult deriveBalances(String broker, LocalDateTime asOf) {
        AccountSnapshot account = brokerService.getAccountInfo(broker);
        List<Position> positions = positionLedger.findByBroker(broker);

        Set<String> strategies = new TreeSet<>(positionLedger.findStrategies(broker));
        strategies.addAll(balanceLedgerService.findStrategies(broker));

        Map<String, BigDecimal> priceCache = new HashMap<>();
        Map<String, BigDecimal> positionValueByStrategy = new HashMap<>();
        for (Position position : positions) {
            BigDecimal price = priceCache.computeIfAbsent(
                    position.getSymbol(),
                    symbol -> marketDataService.latestPriceOrElse(broker, symbol, position.getLatestPrice()));
            if (price == null) {
                log.warn("No price for {} [{}] at {}; valued at zero", position.getSymbol(), position.getStrategy(), broker);
            }
            positionValueByStrategy.merge(
                    position.getStrategy(), PositionValueCalculator.marketValue(position, price), BigDecimal::add);
        }

        List<Balance> rows = new ArrayList<>();
        List<StrategyBalance> strategyBalances = new ArrayList<>();
        BigDecimal categorizedSum = BigDecimal.ZERO;
        for (String strategy : strategies) {
            StrategyBalance balance = StrategyBalance.builder()
                    .strategy(strategy)
                    .cash(balanceLedgerService.latestCash(broker, strategy))
                    .positions(positionValueByStrategy.getOrDefault(strategy, BigDecimal.ZERO))
                    .build();
            strategyBalances.add(balance);
            addRows(rows, broker, balance, asOf);
            categorizedSum = categorizedSum.add(balance.getTotal());
        }

        BigDecimal accountValue = account.getValue();
        BigDecimal residual = accountValue.subtract(categorizedSum).max(BigDecimal.ZERO);
        StrategyBalance uncategorized = StrategyBalance.builder()
                .strategy(Position.UNCATEGORIZED)
                .cash(residual)
                .positions(BigDecimal.ZERO)
                .build();
        addRows(rows, broker, uncategorized, asOf);

        if (categorizedSum.compareTo(accountValue) > 0) {
            log.warn(
                    "Strategies at {} account for {} but the broker reports {}; uncategorized residual is zero",
                    broker,
                    categorizedSum,
                    accountValue);
        }

        BigDecimal previousAccountTotal = balanceLedgerService.currentSnapshot(broker).getAccountTotal();
        balanceLedgerService.append(rows);
        accountInfoService.upsert(broker, accountValue, asOf);

        log.info(
                "Balances derived for {}: strategies={}, categorized={}, account={} (was {}), uncategorized={}",
                broker,
                strategyBalances.size(),
                categorizedSum,
                accountValue,
                previousAccountTotal,
                residual);

        return BrokerBalanceResult.builder()
                .broker(broker)
                .asOf(asOf)
                .strategies(strategyBalances)
                .uncategorized(uncategorized)
                .accountValue(accountValue)
                .previousAccountTotal(previousAccountTotal)
                .categorizedSum(categorizedSum)
                .build();
    }

    private static void addRows(List<Balance> rows, String broker, StrategyBalance balance, LocalDateTime asOf) {
        rows.add(row(broker, balance.getStrategy(), BalanceType.CASH, balance.getCash(), asOf));
        rows.add(row(broker, balance.getStrategy(), BalanceType.POSITIONS, balance.getPositions(), asOf));
        rows.add(row(broker, balance.getStrategy(), BalanceType.TOTAL, balance.getTotal(), asOf));
    }

    private static Balance row(String broker, String strategy, BalanceType type, BigDecimal amount, LocalDateTime asOf) {
        return Balance.builder()
                .broker(broker)
                .strategy(strategy)
                .type(type)
                .amount(amount)
                .recordedAt(asOf)
                .build();
    }
}
