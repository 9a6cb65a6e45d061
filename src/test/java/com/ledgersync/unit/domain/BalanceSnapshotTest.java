package com.ledgersync.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.ledgersync.domain.enums.BalanceType;
import com.ledgersync.domain.model.Balance;
import com.ledgersync.domain.model.BalanceSnapshot;
import com.ledgersync.domain.model.Position;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BalanceSnapshotTest {

    private static Balance balance(String strategy, BalanceType type, String amount) {
        return Balance.builder().broker("ibkr").strategy(strategy).type(type).amount(new BigDecimal(amount)).build();
    }

    @Test
    @DisplayName("Amounts are read per strategy and type")
    void readsAmounts() {
        BalanceSnapshot snapshot = BalanceSnapshot.of("ibkr", List.of(
                balance("wheel", BalanceType.CASH, "1000"),
                balance("wheel", BalanceType.POSITIONS, "4000"),
                balance("wheel", BalanceType.TOTAL, "5000")));

        assertThat(snapshot.getBroker()).isEqualTo("ibkr");
        assertThat(snapshot.getStrategies()).containsExactly("wheel");
        assertThat(snapshot.get("wheel", BalanceType.POSITIONS)).isEqualByComparingTo("4000");
    }

    @Test
    @DisplayName("A key that was never recorded reads as zero")
    void missingKeyIsZero() {
        BalanceSnapshot snapshot = BalanceSnapshot.of("ibkr", List.of(balance("wheel", BalanceType.CASH, "10")));

        assertThat(snapshot.get("wheel", BalanceType.TOTAL)).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(snapshot.get("other", BalanceType.CASH)).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    @DisplayName("The account total sums TOTAL rows across strategies, uncategorized included")
    void accountTotal() {
        BalanceSnapshot snapshot = BalanceSnapshot.of("ibkr", List.of(
                balance("wheel", BalanceType.TOTAL, "5000"),
                balance("wheel", BalanceType.CASH, "999"),
                balance(Position.UNCATEGORIZED, BalanceType.TOTAL, "2500.50")));

        assertThat(snapshot.getStrategies()).containsExactlyInAnyOrder("wheel", Position.UNCATEGORIZED);
        assertThat(snapshot.getAccountTotal()).isEqualByComparingTo("7500.50");
    }
}
