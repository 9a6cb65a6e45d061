package com.ledgersync.exception;

public class SyncIterationException extends BaseException {

    public SyncIterationException(String message) {
        super(ErrorCode.SYNC_FAILED, message);
    }

    public SyncIterationException(String message, Throwable cause) {
        super(ErrorCode.SYNC_FAILED, message, cause);
    }
}
