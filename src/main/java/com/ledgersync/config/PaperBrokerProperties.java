package com.ledgersync.config;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * In-memory paper brokers, bound to {@code ledgersync.paper.*}.
 *
 * <pre>
 * ledgersync.paper.brokers.paper.cash=25000
 * ledgersync.paper.brokers.paper.positions.AAPL.quantity=10
 * ledgersync.paper.brokers.paper.positions.AAPL.price=190.50
 * ledgersync.paper.brokers.paper.positions.AAPL.cost-basis=1750
 * </pre>
 */
@ConfigurationProperties(prefix = "ledgersync.paper")
@Getter
@Setter
public class PaperBrokerProperties {

    private Map<String, Account> brokers = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Account {

        private BigDecimal cash = BigDecimal.ZERO;

        private Map<String, Holding> positions = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Holding {

        private BigDecimal quantity = BigDecimal.ZERO;

        private BigDecimal price;

        private BigDecimal costBasis;
    }
}
