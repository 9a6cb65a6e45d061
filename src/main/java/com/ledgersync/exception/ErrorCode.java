package com.ledgersync.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error classification shared by every {@link BaseException}.
 *
 * <p>{@code fatal} codes are the ones allowed to escape the sync orchestrator:
 * an iteration timeout, an iteration that cannot run, and invalid startup
 * configuration. Everything else resolves to an "unavailable" result plus a log entry.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", false),
    NOT_FOUND("NOT_FOUND", false),
    BROKER_ERROR("BROKER_ERROR", false),
    MARKET_DATA_ERROR("MARKET_DATA_ERROR", false),
    INTERNAL_ERROR("INTERNAL_ERROR", false),
    SYNC_TIMEOUT("SYNC_TIMEOUT", true),
    SYNC_FAILED("SYNC_FAILED", true),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", true);

    private final String code;
    private final boolean fatal;
}
