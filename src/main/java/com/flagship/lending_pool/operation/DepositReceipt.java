package com.flagship.lending_pool.operation;

import lombok.Value;

import java.math.BigInteger;

@Value
public class DepositReceipt {
    long poolId;
    String principal;
    BigInteger amount;
    BigInteger shares;
    BigInteger shareBalance;
}
