package com.ledgersync.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.ledgersync.domain.model.Position;
import com.ledgersync.domain.model.StrategyRenameResult;
import com.ledgersync.entity.PositionEntity;
import com.ledgersync.exception.BusinessException;
import com.ledgersync.ledger.StrategyLedgerService;
import com.ledgersync.repository.jpa.BalanceJpaRepository;
import com.ledgersync.repository.jpa.PositionJpaRepository;
import com.ledgersync.repository.jpa.TradeJpaRepository;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StrategyLedgerServiceTest {

    @Mock
    private PositionJpaRepository positionJpaRepository;

    @Mock
    private BalanceJpaRepository balanceJpaRepository;

    @Mock
    private TradeJpaRepository tradeJpaRepository;

    private StrategyLedgerService strategyLedgerService;

    @BeforeEach
    void setUp() {
        strategyLedgerService =
                new StrategyLedgerService(positionJpaRepository, balanceJpaRepository, tradeJpaRepository);
    }

    private static PositionEntity row(String symbol, String strategy) {
        return PositionEntity.builder().id(symbol + "-" + strategy).broker("ibkr").symbol(symbol).strategy(strategy).build();
    }

    @Test
    @DisplayName("Renaming retags positions, balances and trades")
    void renames() {
        when(positionJpaRepository.findByBrokerAndStrategy("ibkr", "wheel")).thenReturn(List.of(row("SPY", "wheel")));
        when(positionJpaRepository.findByBrokerAndStrategy("ibkr", "income")).thenReturn(List.of(row("AAPL", "income")));
        when(positionJpaRepository.renameStrategy("ibkr", "income", "wheel")).thenReturn(1);
        when(balanceJpaRepository.renameStrategy("ibkr", "income", "wheel")).thenReturn(6);
        when(tradeJpaRepository.renameStrategy("ibkr", "income", "wheel")).thenReturn(2);

        StrategyRenameResult result = strategyLedgerService.renameStrategy("ibkr", "income", "wheel");

        assertThat(result.getPositions()).isEqualTo(1);
        assertThat(result.getBalances()).isEqualTo(6);
        assertThat(result.getTrades()).isEqualTo(2);
    }

    @Test
    @DisplayName("Renaming into a strategy that already holds a symbol is refused")
    void clash() {
        when(positionJpaRepository.findByBrokerAndStrategy("ibkr", "wheel")).thenReturn(List.of(row("SPY", "wheel")));
        when(positionJpaRepository.findByBrokerAndStrategy("ibkr", "income")).thenReturn(List.of(row("SPY", "income")));

        assertThatThrownBy(() -> strategyLedgerService.renameStrategy("ibkr", "income", "wheel"))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("SPY");
        verify(positionJpaRepository, never()).renameStrategy(anyString(), anyString(), anyString());
        verify(balanceJpaRepository, never()).renameStrategy(any(), any(), any());
    }

    @Test
    @DisplayName("The uncategorized bucket can be neither source nor target")
    void uncategorizedRefused() {
        assertThatThrownBy(() -> strategyLedgerService.renameStrategy("ibkr", Position.UNCATEGORIZED, "wheel"))
                .isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> strategyLedgerService.renameStrategy("ibkr", "wheel", Position.UNCATEGORIZED))
                .isInstanceOf(BusinessException.class);
        verifyNoInteractions(positionJpaRepository, balanceJpaRepository, tradeJpaRepository);
    }

    @Test
    @DisplayName("Blank target names are refused and same-name renames change nothing")
    void blankAndSameName() {
        assertThatThrownBy(() -> strategyLedgerService.renameStrategy("ibkr", "wheel", " "))
                .isInstanceOf(BusinessException.class);

        StrategyRenameResult result = strategyLedgerService.renameStrategy("ibkr", "wheel", "wheel");

        assertThat(result.getPositions()).isZero();
        verifyNoInteractions(positionJpaRepository, balanceJpaRepository, tradeJpaRepository);
    }
}
