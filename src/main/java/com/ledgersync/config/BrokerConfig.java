package com.ledgersync.config;

import com.ledgersync.broker.BrokerGateway;
import com.ledgersync.broker.BrokerService;
import com.ledgersync.broker.PaperBrokerGateway;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Broker registry wiring.
 *
 * <p>Every {@link BrokerGateway} bean in the context is registered under its own name, followed
 * by one {@link PaperBrokerGateway} per {@code ledgersync.paper.brokers.<name>} entry.
 */
@Configuration
public class BrokerConfig {

    @Bean
    public BrokerService brokerService(
            ObjectProvider<BrokerGateway> gatewayBeans,
            PaperBrokerProperties paperBrokerProperties,
            BrokerProperties brokerProperties) {
        List<BrokerGateway> gateways = gatewayBeans.orderedStream().collect(Collectors.toCollection(ArrayList::new));
        paperBrokerProperties
                .getBrokers()
                .forEach((name, account) -> gateways.add(PaperBrokerGateway.fromProperties(name, account)));
        return new BrokerService(gateways, brokerProperties.getCallTimeout());
    }
}
