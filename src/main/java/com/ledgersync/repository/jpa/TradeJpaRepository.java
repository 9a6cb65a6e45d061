package com.ledgersync.repository.jpa;

import com.ledgersync.domain.enums.TradeStatus;
import com.ledgersync.entity.TradeEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** JPA repository for the trades table. */
@Repository
public interface TradeJpaRepository extends JpaRepository<TradeEntity, String> {

    List<TradeEntity> findByStatus(TradeStatus status);

    List<TradeEntity> findByBrokerAndStrategy(String broker, String strategy);

    @Modifying
    @Query("UPDATE TradeEntity t SET t.strategy = :newStrategy WHERE t.broker = :broker AND t.strategy = :oldStrategy")
    int renameStrategy(
            @Param("broker") String broker,
            @Param("oldStrategy") String oldStrategy,
            @Param("newStrategy") String newStrategy);
}
