package com.ledgersync.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the ledger's exceptions. The {@link ErrorCode} decides how far a failure travels:
 * fatal codes end the iteration, the rest are recorded against the item or broker that
 * failed.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    public boolean isFatal() {
        return errorCode.isFatal();
    }

    /** Fatal {@link BaseException}s pass through stage-level error handling. */
    public static boolean isFatal(Throwable throwable) {
        return throwable instanceof BaseException baseException && baseException.isFatal();
    }
}
