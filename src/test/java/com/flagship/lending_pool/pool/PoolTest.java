package com.flagship.lending_pool.pool;

import com.flagship.lending_pool.accounting.AssetOrientation;
import com.flagship.lending_pool.accounting.LoanTerms;
import com.flagship.lending_pool.exception.LendingErrorCode;
import com.flagship.lending_pool.exception.LendingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class PoolTest {

    private static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }

    private static Pool fresh() {
        return Pool.create(1L, AssetOrientation.ASSET_B_AS_COLLATERAL, new PoolParameters(10, 80, 10));
    }

    @Test
    @DisplayName("Transitions return new instances and leave the original untouched")
    void testImmutableTransitions() {
        Pool empty = fresh();

        Pool funded = empty.deposit(big(1_000), big(1_000));
        Pool lent = funded.borrow(new LoanTerms(big(400), big(20), big(40)));

        assertEquals(BigInteger.ZERO, empty.getCurrentBalanceAmount());
        assertEquals(big(1_000), funded.getCurrentBalanceAmount());
        assertEquals(big(600), lent.getCurrentBalanceAmount());
        assertEquals(big(460), lent.getTotalBorrowAmount());
        assertEquals(big(40), lent.getTotalReserveAmount());
        // 460 + 600 - 40
        assertEquals(big(1_020), lent.totalLiquidity());
    }

    @Test
    @DisplayName("Repay and liquidate move debt back into the balance")
    void testRepayAndLiquidate() {
        Pool lent = fresh().deposit(big(1_000), big(1_000)).borrow(new LoanTerms(big(400), big(20), big(40)));

        Pool repaid = lent.repay(big(100));
        assertEquals(big(360), repaid.getTotalBorrowAmount());
        assertEquals(big(700), repaid.getCurrentBalanceAmount());

        Pool liquidated = repaid.liquidate(big(300), big(360), big(-40));
        assertEquals(BigInteger.ZERO, liquidated.getTotalBorrowAmount());
        assertEquals(BigInteger.ZERO, liquidated.getTotalReserveAmount());
        assertEquals(big(1_000), liquidated.getCurrentBalanceAmount());
    }

    @Test
    @DisplayName("An aggregate that would go negative is an invariant violation")
    void testNegativeAggregate() {
        Pool funded = fresh().deposit(big(100), big(100));

        LendingException e = assertThrows(LendingException.class, () -> funded.withdraw(big(101), big(100)));
        assertEquals(LendingErrorCode.INVARIANT_VIOLATION, e.getCode());
        assertThrows(LendingException.class, () -> funded.borrow(new LoanTerms(big(101), big(0), big(0))));
        assertThrows(LendingException.class, () -> funded.liquidate(big(0), big(0), big(-1)));
    }

    @Test
    @DisplayName("Reserve adjustment stops at an empty reserve")
    void testBoundedReserveDelta() {
        Pool lent = fresh().deposit(big(1_000), big(1_000)).borrow(new LoanTerms(big(400), big(20), big(40)));
        assertEquals(big(40), lent.getTotalReserveAmount());

        assertEquals(big(-40), lent.boundedReserveDelta(big(-100)));
        assertEquals(big(-10), lent.boundedReserveDelta(big(-10)));
        assertEquals(big(25), lent.boundedReserveDelta(big(25)));
        assertEquals(BigInteger.ZERO, fresh().boundedReserveDelta(big(-5)));
    }

    @Test
    @DisplayName("Parameters outside 0..255 are rejected")
    void testParameterRange() {
        assertDoesNotThrow(() -> new PoolParameters(0, 255, 0));

        LendingException e = assertThrows(LendingException.class, () -> new PoolParameters(256, 80, 0));
        assertEquals(LendingErrorCode.INVALID_PARAMETER, e.getCode());
        assertThrows(LendingException.class, () -> new PoolParameters(10, -1, 0));
    }

    @Test
    @DisplayName("Registry hands out sequential ids and reports unknown pools")
    void testRegistry() {
        PoolRegistry registry = new PoolRegistry();
        Pool first = registry.create(AssetOrientation.ASSET_A_AS_COLLATERAL, new PoolParameters(1, 2, 3));
        Pool second = registry.create(AssetOrientation.ASSET_B_AS_COLLATERAL, new PoolParameters(1, 2, 3));

        assertEquals(1L, first.getId());
        assertEquals(2L, second.getId());
        assertEquals(2, registry.findAll().size());
        LendingException e = assertThrows(LendingException.class, () -> registry.require(3));
        assertEquals(LendingErrorCode.POOL_NOT_FOUND, e.getCode());
    }
}
