package com.ledgersync.unit.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ledgersync.config.SyncProperties;
import com.ledgersync.domain.model.SyncIterationResult;
import com.ledgersync.exception.SyncIterationException;
import com.ledgersync.exception.SyncTimeoutException;
import com.ledgersync.sync.SyncOrchestrator;
import com.ledgersync.sync.SyncScheduler;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SyncSchedulerTest {

    @Mock
    private SyncOrchestrator syncOrchestrator;

    private SyncProperties syncProperties;
    private AtomicInteger exits;
    private SyncScheduler syncScheduler;

    @BeforeEach
    void setUp() {
        syncProperties = new SyncProperties();
        syncProperties.setBrokers(List.of("paper"));
        syncProperties.setTimeoutSeconds(30);
        exits = new AtomicInteger();
        syncScheduler = new SyncScheduler(syncOrchestrator, syncProperties, exits::incrementAndGet);
    }

    @Test
    @DisplayName("Runs the configured brokers with the configured deadline")
    void passesConfiguration() {
        when(syncOrchestrator.runIteration(anyList(), any())).thenReturn(SyncIterationResult.builder().build());

        syncScheduler.runScheduledIteration();

        verify(syncOrchestrator).runIteration(List.of("paper"), Duration.ofSeconds(30));
        assertThat(exits).hasValue(0);
    }

    @Test
    @DisplayName("A timeout shuts the process down when exit-on-timeout is set")
    void exitsOnTimeout() {
        when(syncOrchestrator.runIteration(anyList(), any())).thenThrow(new SyncTimeoutException(Duration.ofSeconds(30)));

        syncScheduler.runScheduledIteration();

        assertThat(exits).hasValue(1);
    }

    @Test
    @DisplayName("A timeout is only logged when exit-on-timeout is off")
    void keepsRunningOnTimeout() {
        syncProperties.setExitOnTimeout(false);
        when(syncOrchestrator.runIteration(anyList(), any())).thenThrow(new SyncTimeoutException(Duration.ofSeconds(30)));

        syncScheduler.runScheduledIteration();

        assertThat(exits).hasValue(0);
    }

    @Test
    @DisplayName("A rejected or failed iteration never exits")
    void iterationFailureDoesNotExit() {
        when(syncOrchestrator.runIteration(anyList(), any()))
                .thenThrow(new SyncIterationException("A sync iteration is already running"));

        syncScheduler.runScheduledIteration();

        assertThat(exits).hasValue(0);
    }
}
