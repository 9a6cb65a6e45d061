package com.ledgersync.exception;

import java.util.Map;

/** A ledger operation was refused because it would break a ledger rule. */
public class BusinessException extends BaseException {

    public BusinessException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public BusinessException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
