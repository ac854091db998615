package com.flagship.lending_pool.accounting;

import lombok.Value;

import java.math.BigInteger;

/**
 * Unit sizes (decimals) of the two asset kinds.
 * Used to correct for differing base units when valuing one asset in the other.
 */
@Value
public class AssetScale {
    int decimalsA;
    int decimalsB;

    public AssetScale(int decimalsA, int decimalsB) {
        if (decimalsA < 0 || decimalsB < 0) {
            throw new IllegalArgumentException("Asset decimals must not be negative");
        }
        this.decimalsA = decimalsA;
        this.decimalsB = decimalsB;
    }

    public BigInteger unitOf(AssetKind kind) {
        return BigInteger.TEN.pow(kind == AssetKind.A ? decimalsA : decimalsB);
    }
}
