package com.flagship.lending_pool.custody;

import com.flagship.lending_pool.accounting.AssetKind;

import java.math.BigInteger;

/**
 * Custody could not move the requested amount.
 */
public class InsufficientFundsException extends RuntimeException {

    public InsufficientFundsException(AssetKind kind, String holder, BigInteger requested, BigInteger available) {
        super(String.format("Insufficient %s funds for %s: requested=%s, available=%s",
            kind, holder, requested, available));
    }
}
