package com.ledgersync.exception;

import java.util.Map;

public class BrokerException extends BaseException {

    public BrokerException(String message) {
        super(ErrorCode.BROKER_ERROR, message);
    }

    public BrokerException(String broker, String message) {
        super(ErrorCode.BROKER_ERROR, message, Map.of("broker", broker));
    }

    public BrokerException(String message, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, cause);
    }
}
