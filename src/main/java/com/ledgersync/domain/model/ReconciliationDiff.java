package com.ledgersync.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Explicit change set that turns a broker's ledger rows into the reconciled state.
 *
 * <p>Produced by a pure merge of broker and ledger snapshots and applied in one unit of
 * work. {@code unmanagedSymbols} lists broker symbols that have no ledger row and were
 * left alone, either because uncategorized-position creation is disabled or because the
 * broker holds them short.
 */
@Data
@Builder
public class ReconciliationDiff {

    @Builder.Default
    private List<Position> toDelete = new ArrayList<>();

    @Builder.Default
    private List<PositionUpdate> toUpdate = new ArrayList<>();

    @Builder.Default
    private List<PositionInsert> toInsert = new ArrayList<>();

    @Builder.Default
    private List<String> unmanagedSymbols = new ArrayList<>();

    public boolean isEmpty() {
        return toDelete.isEmpty() && toInsert.isEmpty() && toUpdate.stream().noneMatch(PositionUpdate::isQuantityChanged);
    }
}
