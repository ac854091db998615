package com.flagship.lending_pool.ledger;

import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-pool, per-principal share balances.
 *
 * An entry exists from the first deposit until a full withdrawal; a zero
 * balance is never stored.
 */
@Component
public class DepositorLedger {

    private final Map<LedgerKey, BigInteger> shares = new ConcurrentHashMap<>();

    public BigInteger sharesOf(long poolId, String principal) {
        return shares.getOrDefault(new LedgerKey(poolId, principal), BigInteger.ZERO);
    }

    public void setShares(long poolId, String principal, BigInteger balance) {
        LedgerKey key = new LedgerKey(poolId, principal);
        if (balance.signum() < 0) {
            throw new IllegalArgumentException("Share balance must not be negative: " + key);
        }
        if (balance.signum() == 0) {
            shares.remove(key);
        } else {
            shares.put(key, balance);
        }
    }

    public long countDepositors(long poolId) {
        return shares.keySet().stream().filter(key -> key.getPoolId() == poolId).count();
    }
}
