package com.flagship.lending_pool.accounting;

/**
 * The two asset kinds known to the ledger.
 *
 * Each pool pairs them: one is deposited and borrowed, the other is posted
 * as collateral. Which is which is fixed by the pool's {@link AssetOrientation}.
 */
public enum AssetKind {
    A,
    B
}
