package com.ledgersync.exception;

import java.time.Duration;
import java.util.Map;

/**
 * Thrown when a sync iteration exceeds its deadline. Not caught by the
 * orchestrator; the scheduler exits so the process supervisor restarts it.
 */
public class SyncTimeoutException extends BaseException {

    public SyncTimeoutException(Duration timeout, Throwable cause) {
        super(
                ErrorCode.SYNC_TIMEOUT,
                "Sync iteration exceeded the maximum allowed time of " + timeout.toSeconds() + "s",
                Map.of("timeoutSeconds", timeout.toSeconds()),
                cause);
    }

    public SyncTimeoutException(Duration timeout) {
        this(timeout, null);
    }
}
