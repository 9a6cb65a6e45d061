package com.ledgersync.balance;

import com.ledgersync.domain.model.Position;
import com.ledgersync.instrument.SymbolClassifier;
import java.math.BigDecimal;

/** Market value of ledger positions: price x quantity x instrument multiplier. */
public final class PositionValueCalculator {

    private PositionValueCalculator() {}

    /** Zero when either the price or the quantity is missing. */
    public static BigDecimal marketValue(Position position, BigDecimal price) {
        if (price == null || position.getQuantity() == null) {
            return BigDecimal.ZERO;
        }
        return price.multiply(position.getQuantity()).multiply(SymbolClassifier.valueMultiplier(position.getSymbol()));
    }
}
