package com.flagship.lending_pool.oracle;

import com.flagship.lending_pool.accounting.PriceRate;

/**
 * Source of the asset-B-per-asset-A exchange rate.
 *
 * Synchronous and read-only. An operation reads it once and uses that value
 * throughout.
 */
public interface PriceOracle {

    /**
     * @return the current rate, always positive
     * @throws com.flagship.lending_pool.exception.LendingException with
     *         PRICE_UNAVAILABLE if no fresh rate exists
     */
    PriceRate currentRate();
}
