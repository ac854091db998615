package com.flagship.lending_pool.exception;

/**
 * Broad classes of operation failure. Every category is rejected before any
 * ledger mutation is kept.
 */
public enum ErrorCategory {
    /** Malformed input: zero amounts, out-of-range parameters. */
    VALIDATION,
    /** Not enough balance, collateral or pool liquidity. */
    INSUFFICIENCY,
    /** The request conflicts with current loan or depositor state. */
    STATE_CONFLICT,
    NOT_FOUND,
    FORBIDDEN,
    /** A collaborator (oracle, guard) cannot serve the call right now. */
    UNAVAILABLE,
    INTERNAL
}
