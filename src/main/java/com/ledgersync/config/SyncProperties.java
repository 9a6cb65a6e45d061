package com.ledgersync.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Sync iteration settings, bound to the {@code ledgersync.sync.*} prefix.
 *
 * <p>One instance is handed to the orchestrator and the engines at construction; there are
 * no other switches for reconciliation or uncategorized-position handling. Reconciliation
 * and uncategorized-position creation default to off until validated against real broker data.
 */
@ConfigurationProperties(prefix = "ledgersync.sync")
@Validated
@Getter
@Setter
public class SyncProperties {

    /** Whether the scheduler runs iterations at all. */
    private boolean enabled = true;

    /** Brokers included in every iteration, by gateway name. */
    @NotNull
    private List<String> brokers = new ArrayList<>();

    /** Merge broker positions into the ledger before deriving balances. */
    private boolean reconcilePositions = false;

    /** Insert uncategorized ledger rows for broker quantity no strategy accounts for. */
    private boolean createUncategorizedPositions = false;

    /** Refresh each position's cost basis from its broker during valuation. */
    private boolean updateCostBasis = false;

    /** Deadline for one whole iteration. */
    @Min(1)
    private long timeoutSeconds = 120;

    /** Delay between the end of one iteration and the start of the next. */
    @Min(1000)
    private long intervalMs = 60_000;

    @Min(0)
    private long initialDelayMs = 5_000;

    /** Exit the process with a non-zero code when an iteration times out, so the supervisor restarts it. */
    private boolean exitOnTimeout = true;

    public Duration getTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }
}
