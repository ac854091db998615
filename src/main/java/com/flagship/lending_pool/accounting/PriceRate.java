package com.flagship.lending_pool.accounting;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Exchange rate read from the price oracle: units of asset B per one unit of
 * asset A, as a fixed-point integer with {@code decimals} fractional digits.
 */
@Value
public class PriceRate {
    BigInteger value;
    int decimals;
    Instant observedAt;

    public BigInteger scale() {
        return BigInteger.TEN.pow(decimals);
    }
}
