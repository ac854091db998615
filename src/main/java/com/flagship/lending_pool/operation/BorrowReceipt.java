package com.flagship.lending_pool.operation;

import lombok.Value;

import java.math.BigInteger;

/**
 * Outcome of a borrow: the amount paid out and the amount owed.
 */
@Value
public class BorrowReceipt {
    long poolId;
    String principal;
    BigInteger collateralAmount;
    BigInteger borrowedAmount;
    BigInteger repayAmount;
    BigInteger interestAmount;
    BigInteger feeAmount;
    long startTime;
    long duration;
}
