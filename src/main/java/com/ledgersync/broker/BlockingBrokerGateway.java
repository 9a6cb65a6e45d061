package com.ledgersync.broker;

import com.ledgersync.domain.model.AccountSnapshot;
import com.ledgersync.domain.model.BrokerPosition;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Base class for brokers whose client library only offers blocking calls.
 *
 * <p>Each blocking fetch runs on the caller's thread and its result (or exception) is
 * wrapped in an already-completed future, so the rest of the system handles synchronous
 * and asynchronous brokers identically.
 */
public abstract class BlockingBrokerGateway implements BrokerGateway {

    protected abstract BigDecimal fetchCurrentPrice(String symbol);

    protected abstract Map<String, BrokerPosition> fetchPositions();

    protected abstract AccountSnapshot fetchAccountInfo();

    protected abstract Optional<BigDecimal> fetchCostBasis(String symbol);

    @Override
    public CompletableFuture<BigDecimal> getCurrentPrice(String symbol) {
        return complete(() -> fetchCurrentPrice(symbol));
    }

    @Override
    public CompletableFuture<Map<String, BrokerPosition>> getPositions() {
        return complete(this::fetchPositions);
    }

    @Override
    public CompletableFuture<AccountSnapshot> getAccountInfo() {
        return complete(this::fetchAccountInfo);
    }

    @Override
    public CompletableFuture<Optional<BigDecimal>> getCostBasis(String symbol) {
        return complete(() -> fetchCostBasis(symbol));
    }

    private static <T> CompletableFuture<T> complete(Supplier<T> call) {
        try {
            return CompletableFuture.completedFuture(call.get());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
