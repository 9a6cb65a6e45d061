package com.ledgersync.broker;

import com.ledgersync.domain.model.AccountSnapshot;
import com.ledgersync.domain.model.BrokerPosition;
import com.ledgersync.exception.BaseException;
import com.ledgersync.exception.BrokerException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Name -> {@link BrokerGateway} registry with blocking helpers that await each broker call.
 *
 * <p>Every call is bounded by the configured per-call timeout. Failures surface as
 * {@link BrokerException}; an interrupt (iteration cancelled by its deadline) keeps the
 * thread's interrupt flag set so the caller stops at its next stage check.
 */
public class BrokerService {

    private static final Logger log = LoggerFactory.getLogger(BrokerService.class);

    private final Map<String, BrokerGateway> gateways;
    private final Duration callTimeout;

    public BrokerService(Collection<? extends BrokerGateway> gateways, Duration callTimeout) {
        Map<String, BrokerGateway> byName = new LinkedHashMap<>();
        for (BrokerGateway gateway : gateways) {
            if (byName.putIfAbsent(gateway.getName(), gateway) != null) {
                throw new IllegalArgumentException("Duplicate broker name: " + gateway.getName());
            }
        }
        this.gateways = Collections.unmodifiableMap(byName);
        this.callTimeout = callTimeout;
        log.info("Registered brokers: {}", this.gateways.keySet());
    }

    public BrokerGateway getBroker(String broker) {
        BrokerGateway gateway = gateways.get(broker);
        if (gateway == null) {
            throw new BrokerException(broker, "Unknown broker: " + broker);
        }
        return gateway;
    }

    public boolean isRegistered(String broker) {
        return gateways.containsKey(broker);
    }

    public Collection<String> getBrokerNames() {
        return gateways.keySet();
    }

    public BigDecimal getLatestPrice(String broker, String symbol) {
        BigDecimal price = await(broker, "price " + symbol, getBroker(broker).getCurrentPrice(symbol));
        if (price == null) {
            throw new BrokerException(broker, "Broker " + broker + " returned no price for " + symbol);
        }
        return price;
    }

    public Map<String, BrokerPosition> getPositions(String broker) {
        Map<String, BrokerPosition> positions = await(broker, "positions", getBroker(broker).getPositions());
        return positions != null ? positions : Map.of();
    }

    public AccountSnapshot getAccountInfo(String broker) {
        AccountSnapshot accountSnapshot = await(broker, "account info", getBroker(broker).getAccountInfo());
        if (accountSnapshot == null || accountSnapshot.getValue() == null) {
            throw new BrokerException(broker, "Broker " + broker + " returned no account value");
        }
        return accountSnapshot;
    }

    public Optional<BigDecimal> getCostBasis(String broker, String symbol) {
        Optional<BigDecimal> costBasis = await(broker, "cost basis " + symbol, getBroker(broker).getCostBasis(symbol));
        return costBasis != null ? costBasis : Optional.empty();
    }

    private <T> T await(String broker, String what, CompletableFuture<T> future) {
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new BrokerException("Interrupted while fetching " + what + " from " + broker, e);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new BrokerException("Timed out after " + callTimeout.toSeconds() + "s fetching " + what + " from " + broker, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof BaseException baseException) {
                throw baseException;
            }
            throw new BrokerException("Failed to fetch " + what + " from " + broker + ": " + cause.getMessage(), cause);
        }
    }
}
