package com.ledgersync.reconciliation;

import com.ledgersync.domain.model.BrokerPosition;
import com.ledgersync.domain.model.Position;
import com.ledgersync.domain.model.PositionInsert;
import com.ledgersync.domain.model.PositionUpdate;
import com.ledgersync.domain.model.ReconciliationDiff;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Merges a broker's live positions into its ledger rows without touching strategy tags.
 *
 * <p>Pure: works on copies of the ledger rows and returns the change set. Three passes run
 * in order:
 * <ol>
 *   <li><b>shrink</b> clamps each uncategorized row to the broker quantity no categorized
 *       row accounts for, and drops it when the broker no longer holds the symbol;</li>
 *   <li><b>prune</b> drops every row whose symbol the broker no longer holds;</li>
 *   <li><b>grow</b> aligns the remaining rows with the broker quantity. A symbol held by one
 *       row takes the broker quantity outright. A symbol shared by several strategies keeps
 *       the categorized quantities and sizes the uncategorized row to the remainder.</li>
 * </ol>
 *
 * <p>Uncategorized quantities are never negative: an uncategorized row facing a broker short
 * is clamped to zero, and a short symbol with no ledger row is reported as unmanaged rather
 * than inserted. A broker short held by a single categorized row keeps its sign.
 */
public final class PositionReconciler {

    private PositionReconciler() {}

    public static ReconciliationDiff reconcileSnapshot(
            Map<String, BrokerPosition> brokerPositions,
            Collection<Position> ledgerPositions,
            boolean createUncategorized,
            LocalDateTime asOf) {
        Map<String, BrokerPosition> held = heldPositions(brokerPositions);

        Map<String, Position> working = new LinkedHashMap<>();
        Map<String, Position> originals = new LinkedHashMap<>();
        for (Position position : ledgerPositions) {
            originals.put(position.getId(), position);
            working.put(position.getId(), copy(position));
        }
        Set<String> deleted = new LinkedHashSet<>();
        Set<String> touched = new LinkedHashSet<>();

        // shrink
        for (Position row : working.values()) {
            if (!row.isUncategorized()) {
                continue;
            }
            BrokerPosition brokerPosition = held.get(row.getSymbol());
            if (brokerPosition == null) {
                deleted.add(row.getId());
                continue;
            }
            BigDecimal categorized = categorizedQuantity(working.values(), deleted, row.getSymbol());
            BigDecimal net = nonNegative(brokerPosition.getQuantity().subtract(categorized));
            if (row.getQuantity() == null || row.getQuantity().compareTo(net) > 0) {
                row.setQuantity(net);
                row.setLastUpdated(asOf);
                touched.add(row.getId());
            }
        }

        // prune
        for (Position row : working.values()) {
            if (!held.containsKey(row.getSymbol())) {
                deleted.add(row.getId());
            }
        }

        // grow
        Map<String, List<Position>> bySymbol = new LinkedHashMap<>();
        for (Position row : working.values()) {
            if (!deleted.contains(row.getId())) {
                bySymbol.computeIfAbsent(row.getSymbol(), s -> new ArrayList<>()).add(row);
            }
        }

        List<PositionInsert> inserts = new ArrayList<>();
        List<String> unmanaged = new ArrayList<>();
        for (BrokerPosition brokerPosition : held.values()) {
            String symbol = brokerPosition.getSymbol();
            List<Position> rows = bySymbol.getOrDefault(symbol, List.of());

            if (rows.isEmpty()) {
                if (createUncategorized && brokerPosition.getQuantity().signum() > 0) {
                    inserts.add(PositionInsert.builder()
                            .symbol(symbol)
                            .quantity(brokerPosition.getQuantity())
                            .costBasis(brokerPosition.getCostBasis())
                            .build());
                } else {
                    unmanaged.add(symbol);
                }
            } else if (rows.size() == 1) {
                Position row = rows.get(0);
                row.setQuantity(row.isUncategorized()
                        ? nonNegative(brokerPosition.getQuantity())
                        : brokerPosition.getQuantity());
                row.setLastUpdated(asOf);
                touched.add(row.getId());
            } else {
                Position uncategorized = null;
                BigDecimal categorized = BigDecimal.ZERO;
                for (Position row : rows) {
                    if (row.isUncategorized()) {
                        uncategorized = row;
                    } else {
                        categorized = categorized.add(quantityOf(row));
                        row.setLastUpdated(asOf);
                        touched.add(row.getId());
                    }
                }
                BigDecimal excess = nonNegative(brokerPosition.getQuantity().subtract(categorized));
                if (uncategorized != null) {
                    uncategorized.setQuantity(excess);
                    uncategorized.setLastUpdated(asOf);
                    touched.add(uncategorized.getId());
                } else if (excess.signum() > 0 && createUncategorized) {
                    inserts.add(PositionInsert.builder()
                            .symbol(symbol)
                            .quantity(excess)
                            .costBasis(null)
                            .build());
                }
            }
        }

        List<Position> toDelete = new ArrayList<>();
        for (String id : deleted) {
            toDelete.add(originals.get(id));
        }
        List<PositionUpdate> toUpdate = new ArrayList<>();
        for (String id : touched) {
            if (deleted.contains(id)) {
                continue;
            }
            Position row = working.get(id);
            toUpdate.add(PositionUpdate.builder()
                    .positionId(id)
                    .symbol(row.getSymbol())
                    .strategy(row.getStrategy())
                    .previousQuantity(originals.get(id).getQuantity())
                    .newQuantity(row.getQuantity())
                    .lastUpdated(row.getLastUpdated())
                    .build());
        }

        return ReconciliationDiff.builder()
                .toDelete(toDelete)
                .toUpdate(toUpdate)
                .toInsert(inserts)
                .unmanagedSymbols(unmanaged)
                .build();
    }

    /** Broker rows with a non-zero quantity, keyed and ordered by symbol. */
    private static Map<String, BrokerPosition> heldPositions(Map<String, BrokerPosition> brokerPositions) {
        Map<String, BrokerPosition> held = new TreeMap<>();
        for (Map.Entry<String, BrokerPosition> entry : brokerPositions.entrySet()) {
            BrokerPosition position = entry.getValue();
            if (position == null || position.getQuantity() == null || position.getQuantity().signum() == 0) {
                continue;
            }
            String symbol = position.getSymbol() != null ? position.getSymbol() : entry.getKey();
            held.put(symbol, position.getSymbol() != null ? position : withSymbol(position, symbol));
        }
        return held;
    }

    private static BrokerPosition withSymbol(BrokerPosition position, String symbol) {
        return BrokerPosition.builder()
                .symbol(symbol)
                .quantity(position.getQuantity())
                .costBasis(position.getCostBasis())
                .marketPrice(position.getMarketPrice())
                .build();
    }

    private static BigDecimal categorizedQuantity(Collection<Position> rows, Set<String> deleted, String symbol) {
        BigDecimal sum = BigDecimal.ZERO;
        for (Position row : rows) {
            if (!row.isUncategorized() && symbol.equals(row.getSymbol()) && !deleted.contains(row.getId())) {
                sum = sum.add(quantityOf(row));
            }
        }
        return sum;
    }

    private static BigDecimal quantityOf(Position position) {
        return position.getQuantity() != null ? position.getQuantity() : BigDecimal.ZERO;
    }

    private static BigDecimal nonNegative(BigDecimal value) {
        return value.signum() < 0 ? BigDecimal.ZERO : value;
    }

    private static Position copy(Position position) {
        return position.toBuilder().build();
    }
}
