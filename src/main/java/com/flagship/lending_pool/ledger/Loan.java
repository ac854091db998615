package com.flagship.lending_pool.ledger;

import com.flagship.lending_pool.accounting.LoanTerms;
import com.flagship.lending_pool.exception.LendingErrorCode;
import com.flagship.lending_pool.exception.LendingException;
import lombok.Value;

import java.math.BigInteger;

/**
 * A borrower's loan in one pool.
 *
 * Immutable: repayments and liquidation return new instances. A closed loan
 * has every field zeroed ({@link #CLOSED}). interestAmount and feeAmount are
 * fixed at origination and are not amortized by partial repayments.
 */
@Value
public class Loan {

    public static final Loan CLOSED = new Loan(
        BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO, 0L, 0L);

    BigInteger collateralAmount;
    BigInteger borrowedAmount;
    BigInteger repayAmount;
    BigInteger interestAmount;
    BigInteger feeAmount;
    /** Epoch seconds. */
    long startTime;
    /** Seconds. */
    long duration;

    public static Loan originate(BigInteger collateralAmount, LoanTerms terms, long startTime, long duration) {
        return new Loan(
            collateralAmount,
            terms.getBorrowable(),
            terms.getRepayAmount(),
            terms.getInterestAmount(),
            terms.getFeeAmount(),
            startTime,
            duration
        );
    }

    /**
     * A loan is open while it holds collateral.
     */
    public boolean isOpen() {
        return collateralAmount.signum() > 0;
    }

    /**
     * First instant (epoch seconds) at which the loan may be liquidated.
     * Saturates instead of overflowing for very long durations.
     */
    public long dueAt() {
        return duration > Long.MAX_VALUE - startTime ? Long.MAX_VALUE : startTime + duration;
    }

    public boolean isLiquidatableAt(long now) {
        return isOpen() && now >= dueAt();
    }

    public LoanStatus statusAt(long now) {
        if (!isOpen()) {
            return LoanStatus.CLOSED;
        }
        if (now >= dueAt()) {
            return LoanStatus.LIQUIDATABLE;
        }
        BigInteger originalDebt = borrowedAmount.add(interestAmount).add(feeAmount);
        return repayAmount.compareTo(originalDebt) < 0 ? LoanStatus.REPAYING : LoanStatus.ACTIVE;
    }

    /**
     * Applies a repayment no larger than the outstanding amount.
     * Reaching zero closes the loan; the caller releases the collateral it read before.
     */
    public Loan repay(BigInteger amount) {
        if (amount.signum() <= 0 || amount.compareTo(repayAmount) > 0) {
            throw new LendingException(LendingErrorCode.INVALID_PARAMETER,
                String.format("Repayment %s outside (0, %s]", amount, repayAmount));
        }
        BigInteger remaining = repayAmount.subtract(amount);
        if (remaining.signum() == 0) {
            return CLOSED;
        }
        return new Loan(collateralAmount, borrowedAmount, remaining, interestAmount, feeAmount, startTime, duration);
    }

    public boolean isClosed() {
        return !isOpen() && repayAmount.signum() == 0;
    }
}
