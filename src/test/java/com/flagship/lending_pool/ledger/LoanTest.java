package com.flagship.lending_pool.ledger;

import com.flagship.lending_pool.accounting.LoanTerms;
import com.flagship.lending_pool.exception.LendingErrorCode;
import com.flagship.lending_pool.exception.LendingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class LoanTest {

    private static final long START = 1_700_000_000L;
    private static final long DURATION = 30 * 86_400L;

    private static Loan open() {
        LoanTerms terms = new LoanTerms(BigInteger.valueOf(800), BigInteger.valueOf(50), BigInteger.valueOf(80));
        return Loan.originate(BigInteger.valueOf(500), terms, START, DURATION);
    }

    @Test
    @DisplayName("Originated loan owes borrowed + interest + fee")
    void testOriginate() {
        Loan loan = open();

        assertEquals(BigInteger.valueOf(930), loan.getRepayAmount());
        assertTrue(loan.isOpen());
        assertEquals(START + DURATION, loan.dueAt());
        assertEquals(LoanStatus.ACTIVE, loan.statusAt(START));
    }

    @Test
    @DisplayName("Status moves through REPAYING, LIQUIDATABLE and CLOSED")
    void testStatus() {
        Loan partlyRepaid = open().repay(BigInteger.valueOf(100));

        assertEquals(LoanStatus.REPAYING, partlyRepaid.statusAt(START + 1));
        assertEquals(LoanStatus.REPAYING, partlyRepaid.statusAt(START + DURATION - 1));
        assertEquals(LoanStatus.LIQUIDATABLE, partlyRepaid.statusAt(START + DURATION));
        assertEquals(LoanStatus.CLOSED, Loan.CLOSED.statusAt(START));
    }

    @Test
    @DisplayName("Repaying the full amount closes the loan")
    void testRepayCloses() {
        Loan loan = open();

        Loan closed = loan.repay(BigInteger.valueOf(930));

        assertSame(Loan.CLOSED, closed);
        assertTrue(closed.isClosed());
        assertFalse(closed.isLiquidatableAt(Long.MAX_VALUE));
    }

    @Test
    @DisplayName("Repayments outside (0, outstanding] are rejected")
    void testRepayBounds() {
        Loan loan = open();

        LendingException tooMuch = assertThrows(LendingException.class, () -> loan.repay(BigInteger.valueOf(931)));
        assertEquals(LendingErrorCode.INVALID_PARAMETER, tooMuch.getCode());
        assertThrows(LendingException.class, () -> loan.repay(BigInteger.ZERO));
    }

    @Test
    @DisplayName("Due time saturates instead of overflowing")
    void testDueAtSaturates() {
        LoanTerms terms = new LoanTerms(BigInteger.ONE, BigInteger.ZERO, BigInteger.ZERO);
        Loan loan = Loan.originate(BigInteger.ONE, terms, START, Long.MAX_VALUE);

        assertEquals(Long.MAX_VALUE, loan.dueAt());
        assertFalse(loan.isLiquidatableAt(START + DURATION));
    }
}
