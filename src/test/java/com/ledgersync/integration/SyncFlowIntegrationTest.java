package com.ledgersync.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.ledgersync.domain.enums.BalanceType;
import com.ledgersync.domain.enums.IterationState;
import com.ledgersync.domain.model.Balance;
import com.ledgersync.domain.model.BalanceSnapshot;
import com.ledgersync.domain.model.Position;
import com.ledgersync.domain.model.SyncIterationResult;
import com.ledgersync.ledger.AccountInfoService;
import com.ledgersync.ledger.BalanceLedgerService;
import com.ledgersync.ledger.PositionLedger;
import com.ledgersync.repository.jpa.AccountInfoJpaRepository;
import com.ledgersync.repository.jpa.BalanceJpaRepository;
import com.ledgersync.repository.jpa.PositionJpaRepository;
import com.ledgersync.sync.SyncOrchestrator;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * Full iteration against the paper broker and the in-memory ledger: reconcile, derive
 * balances, revalue. The paper account holds 5000 cash and 10 AAPL at 100.
 */
@SpringBootTest(
        properties = {
            "ledgersync.sync.reconcile-positions=true",
            "ledgersync.sync.create-uncategorized-positions=true",
            "ledgersync.paper.brokers.paper.positions.AAPL.quantity=10",
            "ledgersync.paper.brokers.paper.positions.AAPL.price=100",
            "ledgersync.paper.brokers.paper.positions.AAPL.cost-basis=900"
        })
class SyncFlowIntegrationTest {

    @Autowired
    private SyncOrchestrator syncOrchestrator;

    @Autowired
    private PositionLedger positionLedger;

    @Autowired
    private BalanceLedgerService balanceLedgerService;

    @Autowired
    private AccountInfoService accountInfoService;

    @Autowired
    private PositionJpaRepository positionJpaRepository;

    @Autowired
    private BalanceJpaRepository balanceJpaRepository;

    @Autowired
    private AccountInfoJpaRepository accountInfoJpaRepository;

    @BeforeEach
    void setUp() {
        positionJpaRepository.deleteAll();
        balanceJpaRepository.deleteAll();
        accountInfoJpaRepository.deleteAll();
    }

    private Position position(String symbol, String strategy, String quantity) {
        return Position.builder()
                .broker("paper")
                .symbol(symbol)
                .strategy(strategy)
                .quantity(new BigDecimal(quantity))
                .openedAt(LocalDateTime.now().minusDays(3))
                .build();
    }

    @Test
    @DisplayName("An iteration reconciles the ledger and books the whole account value")
    void fullIteration() {
        positionLedger.insert(position("AAPL", "wheel", "6"));
        positionLedger.insert(position("AAPL", Position.UNCATEGORIZED, "1"));
        positionLedger.insert(position("MSFT", "wheel", "3"));
        balanceLedgerService.append(List.of(Balance.builder()
                .broker("paper")
                .strategy("wheel")
                .type(BalanceType.CASH)
                .amount(new BigDecimal("500"))
                .recordedAt(LocalDateTime.now().minusDays(1))
                .build()));

        SyncIterationResult result = syncOrchestrator.runIteration(List.of("paper"), Duration.ofSeconds(30));

        assertThat(result.getState()).isEqualTo(IterationState.COMPLETED);
        assertThat(result.isClean()).isTrue();
        assertThat(syncOrchestrator.getState()).isEqualTo(IterationState.COMPLETED);

        Map<String, Position> bySymbolAndStrategy = positionLedger.findByBroker("paper").stream()
                .collect(Collectors.toMap(p -> p.getSymbol() + "/" + p.getStrategy(), Function.identity()));
        assertThat(bySymbolAndStrategy).containsOnlyKeys("AAPL/wheel", "AAPL/" + Position.UNCATEGORIZED);
        assertThat(bySymbolAndStrategy.get("AAPL/wheel").getQuantity()).isEqualByComparingTo("6");
        assertThat(bySymbolAndStrategy.get("AAPL/" + Position.UNCATEGORIZED).getQuantity()).isEqualByComparingTo("4");
        assertThat(bySymbolAndStrategy.get("AAPL/wheel").getLatestPrice()).isEqualByComparingTo("100");

        BalanceSnapshot snapshot = balanceLedgerService.currentSnapshot("paper");
        assertThat(snapshot.get("wheel", BalanceType.CASH)).isEqualByComparingTo("500");
        assertThat(snapshot.get("wheel", BalanceType.POSITIONS)).isEqualByComparingTo("600");
        assertThat(snapshot.get("wheel", BalanceType.TOTAL)).isEqualByComparingTo("1100");
        assertThat(snapshot.get(Position.UNCATEGORIZED, BalanceType.POSITIONS)).isEqualByComparingTo("0");
        assertThat(snapshot.get(Position.UNCATEGORIZED, BalanceType.CASH)).isEqualByComparingTo("4900");
        assertThat(snapshot.getAccountTotal()).isEqualByComparingTo("6000");

        assertThat(accountInfoService.get("paper"))
                .hasValueSatisfying(info -> assertThat(info.getValue()).isEqualByComparingTo("6000"));
    }

    @Test
    @DisplayName("A second iteration over unchanged state changes no positions")
    void idempotent() {
        syncOrchestrator.runIteration(List.of("paper"), Duration.ofSeconds(30));
        List<Position> first = positionLedger.findByBroker("paper");

        SyncIterationResult second = syncOrchestrator.runIteration(List.of("paper"), Duration.ofSeconds(30));

        assertThat(second.getBrokerResults().get(0).getReconciliation().hasChanges()).isFalse();
        assertThat(second.getBrokerResults().get(0).getBalances().getPreviousAccountTotal())
                .isEqualByComparingTo("6000");
        assertThat(positionLedger.findByBroker("paper"))
                .extracting(Position::getStrategy, p -> p.getQuantity().stripTrailingZeros().toPlainString())
                .containsExactlyInAnyOrderElementsOf(first.stream()
                        .map(p -> tuple(p.getStrategy(), p.getQuantity().stripTrailingZeros().toPlainString()))
                        .toList());
        assertThat(balanceLedgerService.currentSnapshot("paper").getAccountTotal()).isEqualByComparingTo("6000");
    }
}
