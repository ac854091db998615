package com.flagship.lending_pool.ledger;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-pool, per-principal loan records. Closed loans are not stored.
 */
@Component
public class LoanLedger {

    private final Map<LedgerKey, Loan> loans = new ConcurrentHashMap<>();

    /**
     * Returns the principal's loan in the pool, or {@link Loan#CLOSED} if there is none.
     */
    public Loan get(long poolId, String principal) {
        return loans.getOrDefault(new LedgerKey(poolId, principal), Loan.CLOSED);
    }

    public void put(long poolId, String principal, Loan loan) {
        LedgerKey key = new LedgerKey(poolId, principal);
        if (loan.isClosed()) {
            loans.remove(key);
        } else {
            loans.put(key, loan);
        }
    }

    public long countOpen(long poolId) {
        return loans.keySet().stream().filter(key -> key.getPoolId() == poolId).count();
    }
}
