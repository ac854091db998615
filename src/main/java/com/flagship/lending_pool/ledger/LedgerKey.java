package com.flagship.lending_pool.ledger;

import lombok.Value;

/**
 * (pool, principal) key for the per-pool sub-ledgers.
 */
@Value
public class LedgerKey {
    long poolId;
    String principal;
}
