package com.flagship.lending_pool.pool;

import com.flagship.lending_pool.exception.LendingErrorCode;
import com.flagship.lending_pool.exception.LendingException;
import lombok.Value;

/**
 * Risk parameters of a pool, all whole percentages in 0..255.
 * Only the pool owner changes them, and only between operations.
 */
@Value
public class PoolParameters {
    public static final int MAX_PERCENT = 255;

    /** Yearly interest, percent. */
    int interestRate;
    /** Share of collateral value that may be borrowed, percent. */
    int collateralFactor;
    /** Origination fee taken into the reserve, percent of the borrowed amount. */
    int reserveFeeRate;

    public PoolParameters(int interestRate, int collateralFactor, int reserveFeeRate) {
        this.interestRate = requirePercent("interestRate", interestRate);
        this.collateralFactor = requirePercent("collateralFactor", collateralFactor);
        this.reserveFeeRate = requirePercent("reserveFeeRate", reserveFeeRate);
    }

    private static int requirePercent(String name, int value) {
        if (value < 0 || value > MAX_PERCENT) {
            throw new LendingException(LendingErrorCode.INVALID_PARAMETER,
                String.format("%s must be between 0 and %d, got %d", name, MAX_PERCENT, value));
        }
        return value;
    }
}
