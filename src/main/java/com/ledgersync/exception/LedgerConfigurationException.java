package com.ledgersync.exception;

import java.util.Map;

/** Invalid ledger store or sync configuration detected at startup. */
public class LedgerConfigurationException extends BaseException {

    public LedgerConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public LedgerConfigurationException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFIGURATION_ERROR, message, details);
    }

    public LedgerConfigurationException(String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR, message, cause);
    }
}
