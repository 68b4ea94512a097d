package io.barhistory.core;

import java.util.Objects;

/**
 * Raised when a build or a history operation cannot complete. Carries the status code of the failure.
 */
public class HistoryException extends Exception {
    private final RetCode retCode;

    public HistoryException(RetCode retCode, String message) {
        this(retCode, message, null);
    }

    public HistoryException(RetCode retCode, String message, Throwable cause) {
        super(retCode + ": " + message, cause);
        if (retCode == RetCode.SUCCESS) throw new IllegalArgumentException("SUCCESS is not an error code");
        this.retCode = Objects.requireNonNull(retCode);
    }

    public RetCode retCode() { return retCode; }
}
