package com.flagship.lending_pool.pool;

import com.flagship.lending_pool.accounting.AccountingEngine;
import com.flagship.lending_pool.accounting.AssetOrientation;
import com.flagship.lending_pool.accounting.LoanTerms;
import com.flagship.lending_pool.exception.LendingErrorCode;
import com.flagship.lending_pool.exception.LendingException;
import lombok.Value;

import java.math.BigInteger;

/**
 * A lending pool: immutable risk setup plus aggregate accounting.
 *
 * Instances are immutable. Every operation produces a new Pool, which the
 * registry swaps in; the previous instance is what a rollback puts back.
 *
 * Aggregates:
 * - totalBorrowAmount: outstanding repay amounts of all loans
 * - totalAssetAmount: shares issued to depositors
 * - totalReserveAmount: fees not yet distributed
 * - currentBalanceAmount: un-borrowed deposit asset held by the pool
 */
@Value
public class Pool {
    long id;
    AssetOrientation orientation;
    PoolParameters parameters;
    BigInteger totalBorrowAmount;
    BigInteger totalAssetAmount;
    BigInteger totalReserveAmount;
    BigInteger currentBalanceAmount;

    public static Pool create(long id, AssetOrientation orientation, PoolParameters parameters) {
        return new Pool(id, orientation, parameters,
            BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO);
    }

    /**
     * totalBorrow + currentBalance - totalReserve, computed fresh.
     */
    public BigInteger totalLiquidity() {
        return AccountingEngine.totalLiquidity(totalBorrowAmount, currentBalanceAmount, totalReserveAmount);
    }

    public Pool withParameters(PoolParameters newParameters) {
        return new Pool(id, orientation, newParameters,
            totalBorrowAmount, totalAssetAmount, totalReserveAmount, currentBalanceAmount);
    }

    public Pool deposit(BigInteger amount, BigInteger shares) {
        return new Pool(id, orientation, parameters,
            totalBorrowAmount,
            totalAssetAmount.add(shares),
            totalReserveAmount,
            currentBalanceAmount.add(amount));
    }

    public Pool withdraw(BigInteger amount, BigInteger shares) {
        return new Pool(id, orientation, parameters,
            totalBorrowAmount,
            minus(totalAssetAmount, shares, "totalAssetAmount"),
            totalReserveAmount,
            minus(currentBalanceAmount, amount, "currentBalanceAmount"));
    }

    public Pool borrow(LoanTerms terms) {
        return new Pool(id, orientation, parameters,
            totalBorrowAmount.add(terms.getRepayAmount()),
            totalAssetAmount,
            totalReserveAmount.add(terms.getFeeAmount()),
            minus(currentBalanceAmount, terms.getBorrowable(), "currentBalanceAmount"));
    }

    public Pool repay(BigInteger amount) {
        return new Pool(id, orientation, parameters,
            minus(totalBorrowAmount, amount, "totalBorrowAmount"),
            totalAssetAmount,
            totalReserveAmount,
            currentBalanceAmount.add(amount));
    }

    /**
     * Books a liquidation: the payoff enters the balance, the loan's outstanding
     * debt leaves the borrow total and the reserve moves by {@code reserveDelta}.
     */
    public Pool liquidate(BigInteger payAmount, BigInteger outstandingDebt, BigInteger reserveDelta) {
        return new Pool(id, orientation, parameters,
            minus(totalBorrowAmount, outstandingDebt, "totalBorrowAmount"),
            totalAssetAmount,
            minus(totalReserveAmount, reserveDelta.negate(), "totalReserveAmount"),
            currentBalanceAmount.add(payAmount));
    }

    /**
     * Limits a reserve adjustment so the reserve stops at zero; a shortfall
     * falls on depositors. While every open loan's fee is still in the reserve,
     * a single liquidation never needs the limit.
     */
    public BigInteger boundedReserveDelta(BigInteger reserveDelta) {
        return reserveDelta.max(totalReserveAmount.negate());
    }

    private BigInteger minus(BigInteger value, BigInteger subtrahend, String field) {
        BigInteger result = value.subtract(subtrahend);
        if (result.signum() < 0) {
            throw new LendingException(LendingErrorCode.INVARIANT_VIOLATION,
                String.format("Pool %d: %s would become negative (%s - %s)", id, field, value, subtrahend));
        }
        return result;
    }
}
