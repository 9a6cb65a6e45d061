package com.ledgersync.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.ledgersync.domain.enums.BalanceType;
import com.ledgersync.entity.BalanceEntity;
import com.ledgersync.repository.jpa.BalanceJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

@DataJpaTest
class BalanceJpaRepositoryTest {

    private static final LocalDateTime T1 = LocalDateTime.of(2024, 3, 1, 16, 0);
    private static final LocalDateTime T2 = LocalDateTime.of(2024, 3, 2, 16, 0);

    @Autowired
    private BalanceJpaRepository balanceJpaRepository;

    private BalanceEntity save(String broker, String strategy, BalanceType type, String amount, LocalDateTime at) {
        return balanceJpaRepository.save(BalanceEntity.builder()
                .broker(broker)
                .strategy(strategy)
                .type(type)
                .amount(new BigDecimal(amount))
                .recordedAt(at)
                .build());
    }

    @Test
    @DisplayName("The latest row per strategy and type wins, regardless of insertion order")
    void latestPerKey() {
        save("ibkr", "wheel", BalanceType.CASH, "200", T2);
        save("ibkr", "wheel", BalanceType.CASH, "100", T1);
        save("ibkr", "wheel", BalanceType.TOTAL, "900", T1);
        save("schwab", "wheel", BalanceType.CASH, "5", T2);

        List<BalanceEntity> latest = balanceJpaRepository.findLatestByBroker("ibkr");

        assertThat(latest)
                .extracting(BalanceEntity::getType, entity -> entity.getAmount().stripTrailingZeros().toPlainString())
                .containsExactlyInAnyOrder(
                        tuple(BalanceType.CASH, "200"),
                        tuple(BalanceType.TOTAL, "900"));
    }

    @Test
    @DisplayName("Rows sharing a timestamp resolve to the one inserted last")
    void tieBrokenById() {
        save("ibkr", "wheel", BalanceType.CASH, "1", T1);
        save("ibkr", "wheel", BalanceType.CASH, "2", T1);

        assertThat(balanceJpaRepository.findLatestByBroker("ibkr"))
                .singleElement()
                .satisfies(entity -> assertThat(entity.getAmount()).isEqualByComparingTo("2"));
        assertThat(balanceJpaRepository.findFirstByBrokerAndStrategyAndTypeOrderByRecordedAtDescIdDesc(
                        "ibkr", "wheel", BalanceType.CASH))
                .hasValueSatisfying(entity -> assertThat(entity.getAmount()).isEqualByComparingTo("2"));
    }

    @Test
    @DisplayName("Strategy listing excludes the given bucket")
    void distinctStrategies() {
        save("ibkr", "wheel", BalanceType.CASH, "1", T1);
        save("ibkr", "wheel", BalanceType.TOTAL, "1", T1);
        save("ibkr", "uncategorized", BalanceType.CASH, "1", T1);

        assertThat(balanceJpaRepository.findDistinctStrategies("ibkr", "uncategorized")).containsExactly("wheel");
    }
}
