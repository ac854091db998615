package com.flagship.lending_pool.accounting;

import java.math.BigInteger;

/**
 * Pure accounting functions for the lending pools.
 *
 * No state, no I/O. Every parameter the math depends on (rates, percentages,
 * oracle price, asset scale) is passed in by the caller, so a parameter
 * change between two operations is visible to the next call and nothing else.
 *
 * Rounding rules:
 * - deposits convert amount to shares with floor division
 * - withdrawals convert shares to amount with ceiling division
 * - interest truncates at every division step, in the order
 *   amount * rate / 100 / 365 * days
 */
public final class AccountingEngine {

    static final BigInteger HUNDRED = BigInteger.valueOf(100);
    private static final BigInteger DAYS_PER_YEAR = BigInteger.valueOf(365);
    public static final long SECONDS_PER_DAY = 86_400L;

    private AccountingEngine() {
        // Utility class
    }

    /**
     * Total liquidity of a pool: totalBorrow + currentBalance - totalReserve.
     * Recomputed on every call, never cached. May come out negative only if
     * the pool aggregates are already inconsistent; callers check.
     */
    public static BigInteger totalLiquidity(BigInteger totalBorrowAmount,
                                            BigInteger currentBalanceAmount,
                                            BigInteger totalReserveAmount) {
        return totalBorrowAmount.add(currentBalanceAmount).subtract(totalReserveAmount);
    }

    /**
     * Converts a deposit amount to shares. 1:1 while the pool has no shares or no liquidity.
     */
    public static BigInteger toShares(BigInteger amount, BigInteger totalAssetAmount, BigInteger totalLiquidity) {
        requireNonNegative(amount, "amount");
        if (totalAssetAmount.signum() == 0 || totalLiquidity.signum() == 0) {
            return amount;
        }
        return amount.multiply(totalAssetAmount).divide(totalLiquidity);
    }

    /**
     * Converts shares back to an asset amount, rounded up.
     *
     * @throws IllegalArgumentException if shares are requested from a pool with no shares issued
     */
    public static BigInteger toAmount(BigInteger shares, BigInteger totalLiquidity, BigInteger totalAssetAmount) {
        requireNonNegative(shares, "shares");
        if (shares.signum() == 0) {
            return BigInteger.ZERO;
        }
        if (totalAssetAmount.signum() <= 0) {
            throw new IllegalArgumentException("Pool has no shares outstanding");
        }
        return ceilDiv(shares.multiply(totalLiquidity), totalAssetAmount);
    }

    /**
     * Amount of deposit asset that {@code collateral} allows a borrower to draw.
     */
    public static BigInteger borrowable(BigInteger collateral, int collateralFactor, AssetOrientation orientation,
                                        PriceRate rate, AssetScale scale) {
        requireNonNegative(collateral, "collateral");
        requirePositiveRate(rate);
        return orientation.valueCollateral(collateral, collateralFactor, rate, scale);
    }

    /**
     * Simple, non-compounding interest for the full loan duration.
     * The daily amount is floored before being multiplied by whole days.
     */
    public static BigInteger interest(BigInteger borrowable, int interestRate, long durationSeconds) {
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("Duration must not be negative");
        }
        BigInteger daily = borrowable
            .multiply(BigInteger.valueOf(interestRate))
            .divide(HUNDRED)
            .divide(DAYS_PER_YEAR);
        return daily.multiply(BigInteger.valueOf(durationSeconds / SECONDS_PER_DAY));
    }

    /**
     * Origination fee, credited to the pool reserve.
     */
    public static BigInteger originationFee(BigInteger borrowable, int reserveFeeRate) {
        return borrowable.multiply(BigInteger.valueOf(reserveFeeRate)).divide(HUNDRED);
    }

    /**
     * Sizes a loan: borrowable amount, interest and fee.
     */
    public static LoanTerms quoteLoan(BigInteger collateral, long durationSeconds, int collateralFactor,
                                      int interestRate, int reserveFeeRate, AssetOrientation orientation,
                                      PriceRate rate, AssetScale scale) {
        BigInteger borrowable = borrowable(collateral, collateralFactor, orientation, rate, scale);
        return new LoanTerms(
            borrowable,
            interest(borrowable, interestRate, durationSeconds),
            originationFee(borrowable, reserveFeeRate)
        );
    }

    /**
     * Price a liquidator pays for {@code collateral}: its value at the discount rate.
     * Depends on nothing but the collateral amount, the rate and the scale.
     */
    public static BigInteger payoff(BigInteger collateral, int discountRate, AssetOrientation orientation,
                                    PriceRate rate, AssetScale scale) {
        requireNonNegative(collateral, "collateral");
        requirePositiveRate(rate);
        return orientation.valueCollateral(collateral, discountRate, rate, scale);
    }

    /**
     * Change to the pool reserve when a loan is liquidated.
     *
     * The loan's origination fee always leaves the reserve. When the payoff
     * exceeds the outstanding debt, the part of the payoff above
     * borrowed + interest is added back to the reserve.
     */
    public static BigInteger liquidationReserveDelta(BigInteger payAmount, BigInteger outstandingDebt,
                                                     BigInteger borrowedAmount, BigInteger interestAmount,
                                                     BigInteger feeAmount) {
        if (payAmount.compareTo(outstandingDebt) > 0) {
            BigInteger excess = payAmount.subtract(interestAmount.add(borrowedAmount)).max(BigInteger.ZERO);
            return excess.subtract(feeAmount);
        }
        return feeAmount.negate();
    }

    static BigInteger ceilDiv(BigInteger dividend, BigInteger divisor) {
        BigInteger[] qr = dividend.divideAndRemainder(divisor);
        return qr[1].signum() > 0 ? qr[0].add(BigInteger.ONE) : qr[0];
    }

    private static void requireNonNegative(BigInteger value, String name) {
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException(name + " must be a non-negative amount");
        }
    }

    private static void requirePositiveRate(PriceRate rate) {
        if (rate == null || rate.getValue() == null || rate.getValue().signum() <= 0) {
            throw new IllegalArgumentException("Price rate must be positive");
        }
    }
}
