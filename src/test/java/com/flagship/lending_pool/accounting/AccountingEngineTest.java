package com.flagship.lending_pool.accounting;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the share conversion, loan sizing and liquidation math.
 */
class AccountingEngineTest {

    private static final long DAY = AccountingEngine.SECONDS_PER_DAY;

    /** ETH-like asset A (18 decimals), USDC-like asset B (6 decimals). */
    private static final AssetScale ETH_USDC = new AssetScale(18, 6);

    /** 2000 B per A with 8 fractional digits. */
    private static final PriceRate TWO_THOUSAND = new PriceRate(new BigInteger("200000000000"), 8, Instant.EPOCH);

    private static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }

    @Test
    @DisplayName("First deposit into an empty pool converts 1:1")
    void testToSharesBootstrap() {
        assertEquals(big(100), AccountingEngine.toShares(big(100), BigInteger.ZERO, BigInteger.ZERO));
        assertEquals(big(100), AccountingEngine.toShares(big(100), BigInteger.ZERO, big(50)));
        assertEquals(big(100), AccountingEngine.toShares(big(100), big(1000), BigInteger.ZERO));
    }

    @Test
    @DisplayName("Shares are floored on deposit")
    void testToSharesFloors() {
        // 100 * 1000 / 1039 = 96.24...
        assertEquals(big(96), AccountingEngine.toShares(big(100), big(1000), big(1039)));
        assertEquals(big(50), AccountingEngine.toShares(big(100), big(1000), big(2000)));
    }

    @Test
    @DisplayName("Amounts are rounded up on withdrawal")
    void testToAmountCeils() {
        // 96 * 1039 / 1000 = 99.744
        assertEquals(big(100), AccountingEngine.toAmount(big(96), big(1039), big(1000)));
        assertEquals(big(1000), AccountingEngine.toAmount(big(500), big(2000), big(1000)));
        assertEquals(BigInteger.ZERO, AccountingEngine.toAmount(BigInteger.ZERO, big(2000), big(1000)));
    }

    @Test
    @DisplayName("Converting shares from a pool without shares is rejected")
    void testToAmountWithoutShares() {
        assertThrows(IllegalArgumentException.class,
            () -> AccountingEngine.toAmount(big(10), big(100), BigInteger.ZERO));
    }

    @Test
    @DisplayName("Total liquidity is borrow plus balance minus reserve")
    void testTotalLiquidity() {
        assertEquals(big(1_039_420), AccountingEngine.totalLiquidity(big(919_420), big(200_000), big(80_000)));
    }

    @Test
    @DisplayName("Interest truncates the daily amount before multiplying by days")
    void testInterestTruncation() {
        // 800000 * 10 / 100 = 80000; / 365 = 219 (219.17); * 180 = 39420
        assertEquals(big(39_420), AccountingEngine.interest(big(800_000), 10, 180 * DAY));
        // a partial day does not count
        assertEquals(big(39_420), AccountingEngine.interest(big(800_000), 10, 180 * DAY + DAY - 1));
        // small loans earn nothing once the daily amount floors to zero
        assertEquals(BigInteger.ZERO, AccountingEngine.interest(big(800), 10, 180 * DAY));
    }

    @Test
    @DisplayName("Origination fee is a floored percentage of the borrowed amount")
    void testOriginationFee() {
        assertEquals(big(80_000), AccountingEngine.originationFee(big(800_000), 10));
        assertEquals(big(99), AccountingEngine.originationFee(big(999), 10));
        assertEquals(BigInteger.ZERO, AccountingEngine.originationFee(big(999), 0));
    }

    @Test
    @DisplayName("Asset A collateral is multiplied by the rate with decimal correction")
    void testBorrowableAssetACollateral() {
        // 1 ETH at 2000 USDC, 80% -> 1600 USDC
        BigInteger oneEth = BigInteger.TEN.pow(18);
        BigInteger borrowable = AccountingEngine.borrowable(
            oneEth, 80, AssetOrientation.ASSET_A_AS_COLLATERAL, TWO_THOUSAND, ETH_USDC);
        assertEquals(new BigInteger("1600000000"), borrowable);
    }

    @Test
    @DisplayName("Asset B collateral is divided by the rate with decimal correction")
    void testBorrowableAssetBCollateral() {
        // 2000 USDC at 2000 USDC/ETH, 80% -> 0.8 ETH
        BigInteger twoThousandUsdc = new BigInteger("2000000000");
        BigInteger borrowable = AccountingEngine.borrowable(
            twoThousandUsdc, 80, AssetOrientation.ASSET_B_AS_COLLATERAL, TWO_THOUSAND, ETH_USDC);
        assertEquals(new BigInteger("800000000000000000"), borrowable);
    }

    @Test
    @DisplayName("Loan quote adds interest and fee to the borrowable amount")
    void testQuoteLoan() {
        PriceRate two = new PriceRate(big(2), 0, Instant.EPOCH);
        LoanTerms terms = AccountingEngine.quoteLoan(big(500_000), 180 * DAY, 80, 10, 10,
            AssetOrientation.ASSET_A_AS_COLLATERAL, two, new AssetScale(0, 0));

        assertEquals(big(800_000), terms.getBorrowable());
        assertEquals(big(39_420), terms.getInterestAmount());
        assertEquals(big(80_000), terms.getFeeAmount());
        assertEquals(big(919_420), terms.getRepayAmount());
    }

    @Test
    @DisplayName("Payoff is collateral value at the 95% discount rate")
    void testPayoff() {
        BigInteger oneEth = BigInteger.TEN.pow(18);
        assertEquals(new BigInteger("1900000000"), AccountingEngine.payoff(
            oneEth, 95, AssetOrientation.ASSET_A_AS_COLLATERAL, TWO_THOUSAND, ETH_USDC));

        PriceRate two = new PriceRate(big(2), 0, Instant.EPOCH);
        assertEquals(big(950_000), AccountingEngine.payoff(
            big(500_000), 95, AssetOrientation.ASSET_A_AS_COLLATERAL, two, new AssetScale(0, 0)));
        // 500000 * 95 / (100 * 2)
        assertEquals(big(237_500), AccountingEngine.payoff(
            big(500_000), 95, AssetOrientation.ASSET_B_AS_COLLATERAL, two, new AssetScale(0, 0)));
    }

    @Test
    @DisplayName("Liquidation removes the fee and keeps any payoff above borrowed + interest")
    void testLiquidationReserveDelta() {
        // payoff above the outstanding debt
        assertEquals(big(30_580), AccountingEngine.liquidationReserveDelta(
            big(950_000), big(919_420), big(800_000), big(39_420), big(80_000)));
        // payoff below the outstanding debt: only the fee leaves
        assertEquals(big(-80_000), AccountingEngine.liquidationReserveDelta(
            big(475_000), big(919_420), big(800_000), big(39_420), big(80_000)));
        // after partial repayments the payoff may beat the debt without beating borrowed + interest
        assertEquals(big(-80_000), AccountingEngine.liquidationReserveDelta(
            big(700_000), big(500_000), big(800_000), big(39_420), big(80_000)));
    }

    @Test
    @DisplayName("A zero or missing rate is rejected")
    void testRejectsNonPositiveRate() {
        PriceRate zero = new PriceRate(BigInteger.ZERO, 8, Instant.EPOCH);
        assertThrows(IllegalArgumentException.class, () -> AccountingEngine.borrowable(
            big(1), 80, AssetOrientation.ASSET_A_AS_COLLATERAL, zero, ETH_USDC));
        assertThrows(IllegalArgumentException.class, () -> AccountingEngine.payoff(
            big(1), 95, AssetOrientation.ASSET_B_AS_COLLATERAL, null, ETH_USDC));
    }
}
