package com.ledgersync.repository.jpa;

import com.ledgersync.domain.enums.BalanceType;
import com.ledgersync.entity.BalanceEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the append-only balances table.
 *
 * <p>"Latest" is resolved by recorded_at, then by id for rows sharing a timestamp, so the
 * current view never depends on the physical order rows come back in.
 */
@Repository
public interface BalanceJpaRepository extends JpaRepository<BalanceEntity, Long> {

    Optional<BalanceEntity> findFirstByBrokerAndStrategyAndTypeOrderByRecordedAtDescIdDesc(
            String broker, String strategy, BalanceType type);

    @Query("SELECT b FROM BalanceEntity b WHERE b.broker = :broker AND b.id IN ("
            + "SELECT MAX(b2.id) FROM BalanceEntity b2 WHERE b2.broker = :broker AND b2.recordedAt = ("
            + "SELECT MAX(b3.recordedAt) FROM BalanceEntity b3 "
            + "WHERE b3.broker = b2.broker AND b3.strategy = b2.strategy AND b3.type = b2.type) "
            + "GROUP BY b2.strategy, b2.type)")
    List<BalanceEntity> findLatestByBroker(@Param("broker") String broker);

    @Query("SELECT DISTINCT b.strategy FROM BalanceEntity b WHERE b.broker = :broker AND b.strategy <> :excluded")
    List<String> findDistinctStrategies(@Param("broker") String broker, @Param("excluded") String excluded);

    @Modifying
    @Query("UPDATE BalanceEntity b SET b.strategy = :newStrategy WHERE b.broker = :broker AND b.strategy = :oldStrategy")
    int renameStrategy(
            @Param("broker") String broker,
            @Param("oldStrategy") String oldStrategy,
            @Param("newStrategy") String newStrategy);
}
