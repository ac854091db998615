package com.flagship.lending_pool.exception;

/**
 * Exact failure conditions reported to callers.
 */
public enum LendingErrorCode {
    ZERO_AMOUNT(ErrorCategory.VALIDATION),
    ZERO_COLLATERAL(ErrorCategory.VALIDATION),
    ZERO_REPAY(ErrorCategory.VALIDATION),
    INVALID_PARAMETER(ErrorCategory.VALIDATION),

    INSUFFICIENT_BALANCE(ErrorCategory.INSUFFICIENCY),
    INSUFFICIENT_COLLATERAL(ErrorCategory.INSUFFICIENCY),
    INSUFFICIENT_LIQUIDITY(ErrorCategory.INSUFFICIENCY),
    UNAVAILABLE(ErrorCategory.INSUFFICIENCY),

    ALREADY_BORROWED(ErrorCategory.STATE_CONFLICT),
    NO_ACTIVE_LOAN(ErrorCategory.STATE_CONFLICT),
    SELF_LIQUIDATION(ErrorCategory.STATE_CONFLICT),
    NO_COLLATERAL(ErrorCategory.STATE_CONFLICT),
    NOT_YET_LIQUIDATABLE(ErrorCategory.STATE_CONFLICT),
    REENTRANT_CALL(ErrorCategory.STATE_CONFLICT),

    POOL_NOT_FOUND(ErrorCategory.NOT_FOUND),
    NOT_OWNER(ErrorCategory.FORBIDDEN),

    PRICE_UNAVAILABLE(ErrorCategory.UNAVAILABLE),
    BUSY(ErrorCategory.UNAVAILABLE),

    INVARIANT_VIOLATION(ErrorCategory.INTERNAL);

    private final ErrorCategory category;

    LendingErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
