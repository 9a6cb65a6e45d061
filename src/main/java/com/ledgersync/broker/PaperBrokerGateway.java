package com.ledgersync.broker;

import com.ledgersync.config.PaperBrokerProperties;
import com.ledgersync.domain.model.AccountSnapshot;
import com.ledgersync.domain.model.BrokerPosition;
import com.ledgersync.exception.BrokerException;
import com.ledgersync.instrument.SymbolClassifier;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory broker for local runs and tests.
 *
 * <p>Holds cash, positions and a price table. Account value is cash plus the market value
 * of every position (price x quantity x instrument multiplier), the same way a real broker
 * reports net liquidation value. State can be changed at runtime to simulate fills and
 * price moves.
 */
public class PaperBrokerGateway extends BlockingBrokerGateway {

    private static final Logger log = LoggerFactory.getLogger(PaperBrokerGateway.class);

    private final String name;
    private final Map<String, BrokerPosition> positions = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> prices = new ConcurrentHashMap<>();
    private volatile BigDecimal cash;

    public PaperBrokerGateway(String name, BigDecimal cash) {
        this.name = name;
        this.cash = cash != null ? cash : BigDecimal.ZERO;
    }

    /** Builds a paper broker from its {@code ledgersync.paper.brokers.<name>} settings. */
    public static PaperBrokerGateway fromProperties(String name, PaperBrokerProperties.Account account) {
        PaperBrokerGateway gateway = new PaperBrokerGateway(name, account.getCash());
        account.getPositions().forEach((symbol, holding) -> {
            if (holding.getPrice() != null) {
                gateway.setPrice(symbol, holding.getPrice());
            }
            gateway.setPosition(symbol, holding.getQuantity(), holding.getCostBasis());
        });
        log.info("Paper broker {} initialised: cash={}, positions={}", name, gateway.cash, gateway.positions.size());
        return gateway;
    }

    @Override
    public String getName() {
        return name;
    }

    /** Sets (or clears, when quantity is zero) the held quantity for a symbol. */
    public void setPosition(String symbol, BigDecimal quantity, BigDecimal costBasis) {
        if (quantity == null || quantity.signum() == 0) {
            positions.remove(symbol);
            return;
        }
        positions.put(
                symbol,
                BrokerPosition.builder()
                        .symbol(symbol)
                        .quantity(quantity)
                        .costBasis(costBasis)
                        .marketPrice(prices.get(symbol))
                        .build());
    }

    public void removePosition(String symbol) {
        positions.remove(symbol);
    }

    public void setPrice(String symbol, BigDecimal price) {
        prices.put(symbol, price);
        BrokerPosition position = positions.get(symbol);
        if (position != null) {
            position.setMarketPrice(price);
        }
    }

    public void setCash(BigDecimal cash) {
        this.cash = cash;
    }

    @Override
    protected BigDecimal fetchCurrentPrice(String symbol) {
        BigDecimal price = prices.get(symbol);
        if (price == null) {
            throw new BrokerException(name, "No price available for " + symbol + " at paper broker " + name);
        }
        return price;
    }

    @Override
    protected Map<String, BrokerPosition> fetchPositions() {
        Map<String, BrokerPosition> snapshot = new LinkedHashMap<>();
        positions.forEach((symbol, position) -> snapshot.put(
                symbol,
                BrokerPosition.builder()
                        .symbol(position.getSymbol())
                        .quantity(position.getQuantity())
                        .costBasis(position.getCostBasis())
                        .marketPrice(position.getMarketPrice())
                        .build()));
        return snapshot;
    }

    @Override
    protected AccountSnapshot fetchAccountInfo() {
        BigDecimal marketValue = BigDecimal.ZERO;
        for (BrokerPosition position : positions.values()) {
            BigDecimal price = prices.getOrDefault(position.getSymbol(), BigDecimal.ZERO);
            marketValue = marketValue.add(price.multiply(position.getQuantity())
                    .multiply(SymbolClassifier.valueMultiplier(position.getSymbol())));
        }
        return AccountSnapshot.builder().cash(cash).value(cash.add(marketValue)).build();
    }

    @Override
    protected Optional<BigDecimal> fetchCostBasis(String symbol) {
        BrokerPosition position = positions.get(symbol);
        return position == null ? Optional.empty() : Optional.ofNullable(position.getCostBasis());
    }
}
