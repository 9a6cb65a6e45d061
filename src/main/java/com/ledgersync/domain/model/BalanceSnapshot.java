package com.ledgersync.domain.model;

import com.ledgersync.domain.enums.BalanceType;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Current view derived from the balance history of one broker: the latest amount per
 * (strategy, type). Built from the rows returned by the "latest per key" query, so it
 * never depends on insertion order.
 */
public class BalanceSnapshot {

    private final String broker;
    private final Map<String, Map<BalanceType, BigDecimal>> amounts = new TreeMap<>();

    private BalanceSnapshot(String broker) {
        this.broker = broker;
    }

    public static BalanceSnapshot of(String broker, Collection<Balance> latestRows) {
        BalanceSnapshot snapshot = new BalanceSnapshot(broker);
        for (Balance balance : latestRows) {
            snapshot.amounts
                    .computeIfAbsent(balance.getStrategy(), s -> new EnumMap<>(BalanceType.class))
                    .put(balance.getType(), balance.getAmount());
        }
        return snapshot;
    }

    public String getBroker() {
        return broker;
    }

    public Set<String> getStrategies() {
        return Collections.unmodifiableSet(amounts.keySet());
    }

    /** Latest amount for the key, or ZERO when the strategy never recorded that type. */
    public BigDecimal get(String strategy, BalanceType type) {
        Map<BalanceType, BigDecimal> byType = amounts.get(strategy);
        if (byType == null) {
            return BigDecimal.ZERO;
        }
        return byType.getOrDefault(type, BigDecimal.ZERO);
    }

    /** Sum of the latest TOTAL rows across every strategy, uncategorized included. */
    public BigDecimal getAccountTotal() {
        return amounts.keySet().stream()
                .map(strategy -> get(strategy, BalanceType.TOTAL))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
