package com.flagship.lending_pool.exception;

/**
 * Failure of a lending operation, tagged with the exact condition.
 *
 * Thrown synchronously; never retried inside the ledger.
 */
public class LendingException extends RuntimeException {

    private final LendingErrorCode code;

    public LendingException(LendingErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public LendingException(LendingErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public LendingErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }
}
