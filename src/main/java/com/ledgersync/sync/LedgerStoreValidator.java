package com.ledgersync.sync;

import com.ledgersync.broker.BrokerService;
import com.ledgersync.config.SyncProperties;
import com.ledgersync.exception.LedgerConfigurationException;
import jakarta.annotation.PostConstruct;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Refuses to start against a ledger store or broker list the sync cannot work with.
 *
 * <p>The ledger must be a JDBC database (the append-only balance history and the
 * reconciliation diff need transactions), and every broker listed in
 * {@code ledgersync.sync.brokers} must be registered.
 */
@Component
public class LedgerStoreValidator {

    private static final Logger log = LoggerFactory.getLogger(LedgerStoreValidator.class);

    private final DataSource dataSource;
    private final BrokerService brokerService;
    private final SyncProperties syncProperties;

    public LedgerStoreValidator(DataSource dataSource, BrokerService brokerService, SyncProperties syncProperties) {
        this.dataSource = dataSource;
        this.brokerService = brokerService;
        this.syncProperties = syncProperties;
    }

    @PostConstruct
    public void validate() {
        String url = ledgerUrl();
        if (url == null || !url.startsWith("jdbc:")) {
            throw new LedgerConfigurationException(
                    "Ledger store must be a JDBC database, got: " + url, Map.of("url", String.valueOf(url)));
        }

        List<String> unknown = syncProperties.getBrokers().stream()
                .filter(broker -> !brokerService.isRegistered(broker))
                .toList();
        if (!unknown.isEmpty()) {
            throw new LedgerConfigurationException(
                    "Unknown brokers in ledgersync.sync.brokers: " + unknown + ", registered: "
                            + brokerService.getBrokerNames(),
                    Map.of("brokers", unknown));
        }
        if (syncProperties.getBrokers().isEmpty()) {
            log.warn("No brokers configured in ledgersync.sync.brokers; iterations will only revalue positions");
        }
        log.info("Ledger store {} validated; brokers={}", url, syncProperties.getBrokers());
    }

    private String ledgerUrl() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.getMetaData().getURL();
        } catch (SQLException e) {
            throw new LedgerConfigurationException("Ledger store is not reachable: " + e.getMessage(), e);
        }
    }
}
