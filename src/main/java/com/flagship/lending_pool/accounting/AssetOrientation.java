package com.flagship.lending_pool.accounting;

import java.math.BigInteger;

/**
 * Which asset kind a pool lends and which it accepts as collateral.
 *
 * Fixed at pool creation. Collateral valuation is the only place where the
 * orientation changes the math: asset A collateral is multiplied by the
 * oracle rate, asset B collateral is divided by it.
 */
public enum AssetOrientation {

    /**
     * Depositors supply asset B; borrowers post asset A.
     */
    ASSET_A_AS_COLLATERAL(AssetKind.B, AssetKind.A) {
        @Override
        BigInteger valueCollateral(BigInteger collateral, int percent, PriceRate rate, AssetScale scale) {
            BigInteger numerator = collateral
                .multiply(BigInteger.valueOf(percent))
                .multiply(rate.getValue())
                .multiply(scale.unitOf(AssetKind.B));
            BigInteger denominator = AccountingEngine.HUNDRED
                .multiply(rate.scale())
                .multiply(scale.unitOf(AssetKind.A));
            return numerator.divide(denominator);
        }
    },

    /**
     * Depositors supply asset A; borrowers post asset B.
     */
    ASSET_B_AS_COLLATERAL(AssetKind.A, AssetKind.B) {
        @Override
        BigInteger valueCollateral(BigInteger collateral, int percent, PriceRate rate, AssetScale scale) {
            BigInteger numerator = collateral
                .multiply(BigInteger.valueOf(percent))
                .multiply(rate.scale())
                .multiply(scale.unitOf(AssetKind.A));
            BigInteger denominator = AccountingEngine.HUNDRED
                .multiply(rate.getValue())
                .multiply(scale.unitOf(AssetKind.B));
            return numerator.divide(denominator);
        }
    };

    private final AssetKind depositAsset;
    private final AssetKind collateralAsset;

    AssetOrientation(AssetKind depositAsset, AssetKind collateralAsset) {
        this.depositAsset = depositAsset;
        this.collateralAsset = collateralAsset;
    }

    /**
     * The asset depositors supply, borrowers draw and repay.
     */
    public AssetKind depositAsset() {
        return depositAsset;
    }

    public AssetKind collateralAsset() {
        return collateralAsset;
    }

    /**
     * Values {@code collateral} in deposit-asset base units, scaled by {@code percent}/100.
     * Single floor division; the rate must be positive.
     */
    abstract BigInteger valueCollateral(BigInteger collateral, int percent, PriceRate rate, AssetScale scale);
}
