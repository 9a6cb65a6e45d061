package com.ledgersync.repository.jpa;

import com.ledgersync.entity.PositionEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the positions table.
 * Reconciliation reads and rewrites all rows of one broker; valuation reads every row.
 */
@Repository
public interface PositionJpaRepository extends JpaRepository<PositionEntity, String> {

    List<PositionEntity> findByBroker(String broker);

    List<PositionEntity> findByBrokerAndStrategy(String broker, String strategy);

    Optional<PositionEntity> findByBrokerAndSymbolAndStrategy(String broker, String symbol, String strategy);

    @Query("SELECT DISTINCT p.strategy FROM PositionEntity p WHERE p.broker = :broker AND p.strategy <> :excluded")
    List<String> findDistinctStrategies(@Param("broker") String broker, @Param("excluded") String excluded);

    @Modifying
    @Query("UPDATE PositionEntity p SET p.strategy = :newStrategy WHERE p.broker = :broker AND p.strategy = :oldStrategy")
    int renameStrategy(
            @Param("broker") String broker,
            @Param("oldStrategy") String oldStrategy,
            @Param("newStrategy") String newStrategy);
}
