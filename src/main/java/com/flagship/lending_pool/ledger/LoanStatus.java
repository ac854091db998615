package com.flagship.lending_pool.ledger;

/**
 * Lifecycle of a loan, derived from its fields and the current time.
 *
 * ACTIVE → REPAYING → CLOSED, or ACTIVE/REPAYING → LIQUIDATABLE → CLOSED (liquidated).
 */
public enum LoanStatus {
    /** Originated, nothing repaid, not yet due. */
    ACTIVE,
    /** Partially repaid, not yet due. */
    REPAYING,
    /** Due; any third party may liquidate it. */
    LIQUIDATABLE,
    /** Fully repaid, liquidated, or never opened. */
    CLOSED
}
