package com.ledgersync.sync;

import com.ledgersync.config.SyncProperties;
import com.ledgersync.exception.SyncIterationException;
import com.ledgersync.exception.SyncTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationContext;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs sync iterations at a fixed delay for the configured brokers.
 *
 * <p>A timed-out iteration is treated as fatal: with {@code ledgersync.sync.exit-on-timeout}
 * on, the application shuts down with exit code 1 and the process supervisor restarts it.
 */
@Component
@ConditionalOnProperty(prefix = "ledgersync.sync", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

    public static final int TIMEOUT_EXIT_CODE = 1;

    private final SyncOrchestrator syncOrchestrator;
    private final SyncProperties syncProperties;
    private final Runnable exitAction;

    @Autowired
    public SyncScheduler(
            SyncOrchestrator syncOrchestrator, SyncProperties syncProperties, ApplicationContext applicationContext) {
        this(
                syncOrchestrator,
                syncProperties,
                () -> System.exit(SpringApplication.exit(applicationContext, () -> TIMEOUT_EXIT_CODE)));
    }

    public SyncScheduler(SyncOrchestrator syncOrchestrator, SyncProperties syncProperties, Runnable exitAction) {
        this.syncOrchestrator = syncOrchestrator;
        this.syncProperties = syncProperties;
        this.exitAction = exitAction;
    }

    @Scheduled(
            fixedDelayString = "${ledgersync.sync.interval-ms:60000}",
            initialDelayString = "${ledgersync.sync.initial-delay-ms:5000}")
    public void runScheduledIteration() {
        try {
            syncOrchestrator.runIteration(syncProperties.getBrokers(), syncProperties.getTimeout());
        } catch (SyncTimeoutException e) {
            if (syncProperties.isExitOnTimeout()) {
                log.error("{}; shutting down for restart", e.getMessage());
                exitAction.run();
            } else {
                log.error("{}; next iteration in {}ms", e.getMessage(), syncProperties.getIntervalMs());
            }
        } catch (SyncIterationException e) {
            log.error("Scheduled sync iteration did not complete [{}]: {}", e.getErrorCode().getCode(), e.getMessage());
        }
    }
}
