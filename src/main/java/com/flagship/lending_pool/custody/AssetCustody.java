package com.flagship.lending_pool.custody;

import com.flagship.lending_pool.accounting.AssetKind;

import java.math.BigInteger;

/**
 * Custody collaborator that actually moves assets between principals and the pools.
 *
 * Transfers are a suspension point: an implementation may call out to code
 * that tries to re-enter the lending operations.
 */
public interface AssetCustody {

    BigInteger balanceOf(AssetKind kind, String principal);

    /**
     * Pulls {@code amount} from {@code from} into pool custody.
     *
     * @throws InsufficientFundsException if {@code from} cannot cover the amount
     */
    void transferIn(AssetKind kind, String from, BigInteger amount);

    /**
     * Pays {@code amount} out of pool custody to {@code to}.
     *
     * @throws InsufficientFundsException if pool custody cannot cover the amount
     */
    void transferOut(AssetKind kind, String to, BigInteger amount);
}
