package com.flagship.lending_pool.operation;

import lombok.Value;

import java.math.BigInteger;

@Value
public class LiquidationReceipt {
    long poolId;
    String borrower;
    String liquidator;
    BigInteger collateralReleased;
    BigInteger payAmount;
    BigInteger debtCleared;
    BigInteger reserveDelta;
}
