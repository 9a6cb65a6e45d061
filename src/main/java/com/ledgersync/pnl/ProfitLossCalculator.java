package com.ledgersync.pnl;

import com.ledgersync.domain.enums.TradeSide;
import com.ledgersync.domain.model.Position;
import com.ledgersync.domain.model.Trade;
import com.ledgersync.instrument.SymbolClassifier;
import com.ledgersync.ledger.PositionLedger;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Realized P/L of a trade against the open position it closes.
 *
 * <ul>
 *   <li><b>Sell, whole position:</b> executedPrice * qty - costBasis.</li>
 *   <li><b>Sell, part of the position:</b> (executedPrice - costBasis / positionQty) * qty.
 *       Selling 50 of 100 shares with cost basis 1000 at 12 -> (12 - 10) * 50 = 100.</li>
 *   <li><b>Buy covering a short:</b> (|costBasis| / |positionQty| - executedPrice) * |qty|,
 *       for full and partial covers alike.</li>
 *   <li><b>Buy opening or adding to a long:</b> no realized P/L.</li>
 * </ul>
 *
 * <p>Sell P/L is scaled by the instrument multiplier: 100 for options, the contract size for
 * futures. Cover P/L is not scaled. Whenever the inputs are incomplete the result is empty.
 */
@Service
public class ProfitLossCalculator {

    private static final Logger log = LoggerFactory.getLogger(ProfitLossCalculator.class);

    private final PositionLedger positionLedger;

    public ProfitLossCalculator(PositionLedger positionLedger) {
        this.positionLedger = positionLedger;
    }

    /**
     * Looks up the position the trade closes and computes its realized P/L. A failed
     * lookup yields an empty result, like any failed computation.
     */
    public Optional<BigDecimal> profitLoss(Trade trade) {
        Position position;
        try {
            position = positionLedger
                    .find(trade.getBroker(), trade.getSymbol(), trade.getStrategy())
                    .orElse(null);
        } catch (RuntimeException e) {
            log.error("Position lookup failed for trade {}; profit/loss not computed", trade.getId(), e);
            return Optional.empty();
        }
        return calculate(trade, position);
    }

    /**
     * @param position the matching open position, or null when the strategy holds none
     */
    public static Optional<BigDecimal> calculate(Trade trade, Position position) {
        try {
            if (trade.getExecutedPrice() == null) {
                log.error("Trade {} has no executed price; profit/loss not computed", trade.getId());
                return Optional.empty();
            }
            if (trade.getSide() == TradeSide.BUY) {
                return shortCover(trade, position);
            }
            return sell(trade, position);
        } catch (RuntimeException e) {
            log.error("Failed to compute profit/loss for trade {}", trade.getId(), e);
            return Optional.empty();
        }
    }

    private static Optional<BigDecimal> shortCover(Trade trade, Position position) {
        if (position == null || !position.isShort()) {
            log.debug("Trade {} opens or adds to a long position; no realized profit/loss", trade.getId());
            return Optional.empty();
        }
        if (position.getCostBasis() == null) {
            log.warn("Short position {} [{}] has no cost basis; cover profit/loss not computed",
                    position.getSymbol(), position.getStrategy());
            return Optional.empty();
        }
        BigDecimal costPerShare = position.getCostBasis().abs()
                .divide(position.getQuantity().abs(), MathContext.DECIMAL64);
        BigDecimal profitLoss = costPerShare.subtract(trade.getExecutedPrice())
                .multiply(trade.getQuantity().abs());
        log.info("Short cover {} x {}: profit/loss {}", trade.getQuantity(), trade.getSymbol(), profitLoss);
        return Optional.of(scale(profitLoss));
    }

    private static Optional<BigDecimal> sell(Trade trade, Position position) {
        if (position == null || position.getQuantity() == null || position.getCostBasis() == null) {
            log.warn(
                    "No open position with cost basis for sell {} x {} [{}] at {}; profit/loss not computed",
                    trade.getQuantity(),
                    trade.getSymbol(),
                    trade.getStrategy(),
                    trade.getBroker());
            return Optional.empty();
        }

        BigDecimal profitLoss;
        if (position.getQuantity().compareTo(trade.getQuantity()) == 0) {
            profitLoss = trade.getExecutedPrice().multiply(trade.getQuantity()).subtract(position.getCostBasis());
        } else {
            BigDecimal costPerShare = position.getCostBasis().divide(position.getQuantity(), MathContext.DECIMAL64);
            profitLoss = trade.getExecutedPrice().subtract(costPerShare).multiply(trade.getQuantity());
        }
        profitLoss = profitLoss.multiply(SymbolClassifier.valueMultiplier(trade.getSymbol()));
        log.info("Sell {} x {}: profit/loss {}", trade.getQuantity(), trade.getSymbol(), profitLoss);
        return Optional.of(scale(profitLoss));
    }

    private static BigDecimal scale(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
