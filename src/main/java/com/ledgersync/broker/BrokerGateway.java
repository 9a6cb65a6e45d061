package com.ledgersync.broker;

import com.ledgersync.domain.model.AccountSnapshot;
import com.ledgersync.domain.model.BrokerPosition;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Unified abstraction over one broker connection. Every component that needs broker
 * prices, positions or account figures MUST go through this interface, usually via
 * {@link BrokerService}, never through broker-specific clients.
 *
 * <p>All operations return futures. Brokers with a native asynchronous API implement this
 * interface directly; brokers with a blocking client extend {@link BlockingBrokerGateway},
 * so callers always await a result regardless of the broker's fetch style.
 *
 * <p>Returned data is read-only input to the ledger: callers never mutate it.
 */
public interface BrokerGateway {

    /** Unique broker name, used as the ledger's broker key. */
    String getName();

    /**
     * Latest traded (or mark) price for a symbol.
     *
     * @return future completing with the price, or exceptionally with
     *     {@link com.ledgersync.exception.BrokerException} when no price is available
     */
    CompletableFuture<BigDecimal> getCurrentPrice(String symbol);

    /**
     * Current positions held at the broker.
     *
     * @return future completing with symbol -> position; flat positions are omitted
     */
    CompletableFuture<Map<String, BrokerPosition>> getPositions();

    /** Account-level figures; {@code value} is the total account value. */
    CompletableFuture<AccountSnapshot> getAccountInfo();

    /**
     * Total cost basis of the broker's position in a symbol.
     *
     * @return future completing with empty when the broker does not know the cost basis
     */
    CompletableFuture<Optional<BigDecimal>> getCostBasis(String symbol);
}
