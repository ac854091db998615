package com.flagship.lending_pool.accounting;

import lombok.Value;

import java.math.BigInteger;

/**
 * Sizing of a loan at origination.
 *
 * Invariant: repayAmount = borrowable + interestAmount + feeAmount.
 */
@Value
public class LoanTerms {
    BigInteger borrowable;
    BigInteger interestAmount;
    BigInteger feeAmount;

    public BigInteger getRepayAmount() {
        return borrowable.add(interestAmount).add(feeAmount);
    }
}
