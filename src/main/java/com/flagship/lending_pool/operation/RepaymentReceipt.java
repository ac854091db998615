package com.flagship.lending_pool.operation;

import lombok.Value;

import java.math.BigInteger;

/**
 * Outcome of a repayment. {@code appliedAmount} is the offer clamped to the debt.
 */
@Value
public class RepaymentReceipt {
    long poolId;
    String principal;
    BigInteger appliedAmount;
    BigInteger remainingAmount;
    BigInteger collateralReleased;

    public boolean isClosed() {
        return remainingAmount.signum() == 0;
    }
}
