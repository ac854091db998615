package com.flagship.lending_pool.operation;

import com.flagship.lending_pool.accounting.AccountingEngine;
import com.flagship.lending_pool.accounting.AssetKind;
import com.flagship.lending_pool.accounting.AssetScale;
import com.flagship.lending_pool.accounting.LoanTerms;
import com.flagship.lending_pool.config.LendingProperties;
import com.flagship.lending_pool.custody.AssetCustody;
import com.flagship.lending_pool.custody.InsufficientFundsException;
import com.flagship.lending_pool.event.BorrowedEvent;
import com.flagship.lending_pool.event.DepositedEvent;
import com.flagship.lending_pool.event.LendingEvent;
import com.flagship.lending_pool.event.LendingEventPublisher;
import com.flagship.lending_pool.event.LiquidatedEvent;
import com.flagship.lending_pool.event.RepaidEvent;
import com.flagship.lending_pool.event.WithdrawnEvent;
import com.flagship.lending_pool.exception.LendingErrorCode;
import com.flagship.lending_pool.exception.LendingException;
import com.flagship.lending_pool.ledger.DepositorLedger;
import com.flagship.lending_pool.ledger.Loan;
import com.flagship.lending_pool.ledger.LoanLedger;
import com.flagship.lending_pool.observability.CorrelationContext;
import com.flagship.lending_pool.observability.LendingMetrics;
import com.flagship.lending_pool.oracle.PriceOracle;
import com.flagship.lending_pool.pool.Pool;
import com.flagship.lending_pool.pool.PoolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.function.Function;

/**
 * Operation handlers for deposit, withdraw, borrow, repay and liquidate.
 *
 * Each operation:
 * 1. Acquires the execution guard (re-entrant calls fail immediately)
 * 2. Validates input and state; every failure here happens before any mutation
 * 3. Reads the oracle at most once
 * 4. Pulls assets in, updates ledgers, pays assets out
 * 5. Checks the pool invariants
 * 6. Publishes notifications after the guard is released
 *
 * Any failure after the first mutation rolls back every recorded step, so an
 * operation applies completely or not at all.
 */
@Service
@Slf4j
public class LendingPoolService {

    private final PoolRegistry poolRegistry;
    private final DepositorLedger depositorLedger;
    private final LoanLedger loanLedger;
    private final PriceOracle priceOracle;
    private final AssetCustody custody;
    private final ExecutionGuard guard;
    private final LendingEventPublisher eventPublisher;
    private final LendingMetrics metrics;
    private final AssetScale assetScale;
    private final LendingProperties properties;
    private final Clock clock;

    public LendingPoolService(PoolRegistry poolRegistry,
                              DepositorLedger depositorLedger,
                              LoanLedger loanLedger,
                              PriceOracle priceOracle,
                              AssetCustody custody,
                              ExecutionGuard guard,
                              LendingEventPublisher eventPublisher,
                              LendingMetrics metrics,
                              AssetScale assetScale,
                              LendingProperties properties,
                              Clock clock) {
        this.poolRegistry = poolRegistry;
        this.depositorLedger = depositorLedger;
        this.loanLedger = loanLedger;
        this.priceOracle = priceOracle;
        this.custody = custody;
        this.guard = guard;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.assetScale = assetScale;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Supplies {@code amount} of the pool's deposit asset and mints shares for it.
     *
     * @throws LendingException ZERO_AMOUNT, INSUFFICIENT_BALANCE, POOL_NOT_FOUND
     */
    public DepositReceipt deposit(long poolId, String principal, BigInteger amount) {
        return execute("deposit", poolId, principal, ctx -> {
            requirePositive(amount, LendingErrorCode.ZERO_AMOUNT, "Deposit amount must be greater than zero");
            Pool pool = poolRegistry.require(poolId);
            AssetKind asset = pool.getOrientation().depositAsset();

            requireBalance(asset, principal, amount, LendingErrorCode.INSUFFICIENT_BALANCE);

            BigInteger shares = AccountingEngine.toShares(amount, pool.getTotalAssetAmount(), pool.totalLiquidity());
            if (shares.signum() == 0) {
                throw new LendingException(LendingErrorCode.ZERO_AMOUNT,
                    String.format("Deposit of %s is too small to mint a share", amount));
            }

            pullIn(ctx, asset, principal, amount, LendingErrorCode.INSUFFICIENT_BALANCE);

            // pool before shares: a reader must not see shares the pool has not issued
            BigInteger shareBalance = depositorLedger.sharesOf(poolId, principal).add(shares);
            writePool(ctx, pool.deposit(amount, shares));
            writeShares(ctx, poolId, principal, shareBalance);

            ctx.emit(DepositedEvent.of(poolId, principal, amount, shares, ctx.now()));
            log.info("Deposit booked: amount={}, shares={}, shareBalance={}", amount, shares, shareBalance);
            return new DepositReceipt(poolId, principal, amount, shares, shareBalance);
        });
    }

    /**
     * Redeems the principal's entire share balance at the current liquidity.
     *
     * @throws LendingException ZERO_AMOUNT if there are no shares, UNAVAILABLE if
     *         the redeemed amount exceeds the pool's un-borrowed balance
     */
    public WithdrawalReceipt withdraw(long poolId, String principal) {
        return execute("withdraw", poolId, principal, ctx -> {
            Pool pool = poolRegistry.require(poolId);
            BigInteger shares = depositorLedger.sharesOf(poolId, principal);
            if (shares.signum() == 0) {
                throw new LendingException(LendingErrorCode.ZERO_AMOUNT, "No shares to withdraw");
            }

            BigInteger amount = AccountingEngine.toAmount(shares, pool.totalLiquidity(), pool.getTotalAssetAmount());
            if (amount.compareTo(pool.getCurrentBalanceAmount()) > 0) {
                throw new LendingException(LendingErrorCode.UNAVAILABLE,
                    String.format("Withdrawal of %s exceeds available pool balance %s",
                        amount, pool.getCurrentBalanceAmount()));
            }

            writeShares(ctx, poolId, principal, BigInteger.ZERO);
            writePool(ctx, pool.withdraw(amount, shares));
            payOut(ctx, pool.getOrientation().depositAsset(), principal, amount);

            ctx.emit(WithdrawnEvent.of(poolId, principal, amount, shares, ctx.now()));
            log.info("Withdrawal booked: amount={}, sharesBurned={}", amount, shares);
            return new WithdrawalReceipt(poolId, principal, amount, shares);
        });
    }

    /**
     * Posts collateral and draws a loan sized by the collateral factor and the oracle rate.
     *
     * @throws LendingException ALREADY_BORROWED, ZERO_COLLATERAL, INSUFFICIENT_COLLATERAL,
     *         INSUFFICIENT_LIQUIDITY, INVALID_PARAMETER, PRICE_UNAVAILABLE
     */
    public BorrowReceipt borrow(long poolId, String principal, BigInteger collateralAmount, long durationSeconds) {
        return execute("borrow", poolId, principal, ctx -> {
            Pool pool = poolRegistry.require(poolId);
            if (loanLedger.get(poolId, principal).isOpen()) {
                throw new LendingException(LendingErrorCode.ALREADY_BORROWED,
                    "Principal already has an active loan in pool " + poolId);
            }
            requirePositive(collateralAmount, LendingErrorCode.ZERO_COLLATERAL, "Collateral amount must be greater than zero");
            if (durationSeconds <= 0) {
                throw new LendingException(LendingErrorCode.INVALID_PARAMETER, "Loan duration must be positive");
            }

            AssetKind collateralAsset = pool.getOrientation().collateralAsset();
            AssetKind loanAsset = pool.getOrientation().depositAsset();
            requireBalance(collateralAsset, principal, collateralAmount, LendingErrorCode.INSUFFICIENT_COLLATERAL);

            LoanTerms terms = AccountingEngine.quoteLoan(
                collateralAmount,
                durationSeconds,
                pool.getParameters().getCollateralFactor(),
                pool.getParameters().getInterestRate(),
                pool.getParameters().getReserveFeeRate(),
                pool.getOrientation(),
                ctx.rate(),
                assetScale);

            if (terms.getBorrowable().signum() == 0) {
                throw new LendingException(LendingErrorCode.INSUFFICIENT_COLLATERAL,
                    String.format("Collateral %s is worth nothing at the current rate", collateralAmount));
            }
            if (pool.getCurrentBalanceAmount().compareTo(terms.getBorrowable()) < 0) {
                throw new LendingException(LendingErrorCode.INSUFFICIENT_LIQUIDITY,
                    String.format("Pool balance %s cannot cover loan of %s",
                        pool.getCurrentBalanceAmount(), terms.getBorrowable()));
            }

            pullIn(ctx, collateralAsset, principal, collateralAmount, LendingErrorCode.INSUFFICIENT_COLLATERAL);

            Loan loan = Loan.originate(collateralAmount, terms, ctx.nowEpochSeconds(), durationSeconds);
            writeLoan(ctx, poolId, principal, loan);
            writePool(ctx, pool.borrow(terms));
            payOut(ctx, loanAsset, principal, terms.getBorrowable());

            ctx.emit(BorrowedEvent.of(poolId, principal, collateralAmount, terms.getBorrowable(),
                terms.getRepayAmount(), durationSeconds, ctx.now()));
            log.info("Loan originated: collateral={}, borrowed={}, interest={}, fee={}, repay={}, duration={}s",
                collateralAmount, terms.getBorrowable(), terms.getInterestAmount(), terms.getFeeAmount(),
                terms.getRepayAmount(), durationSeconds);

            return new BorrowReceipt(poolId, principal, collateralAmount, terms.getBorrowable(),
                terms.getRepayAmount(), terms.getInterestAmount(), terms.getFeeAmount(),
                loan.getStartTime(), loan.getDuration());
        });
    }

    /**
     * Repays up to {@code amount} of the principal's loan. Offers above the
     * outstanding debt are clamped. The repayment that clears the debt releases
     * the collateral.
     *
     * @throws LendingException NO_ACTIVE_LOAN, ZERO_REPAY, INSUFFICIENT_BALANCE
     */
    public RepaymentReceipt repay(long poolId, String principal, BigInteger amount) {
        return execute("repay", poolId, principal, ctx -> {
            Pool pool = poolRegistry.require(poolId);
            Loan loan = loanLedger.get(poolId, principal);
            if (loan.getRepayAmount().signum() == 0) {
                throw new LendingException(LendingErrorCode.NO_ACTIVE_LOAN, "No active loan in pool " + poolId);
            }
            requirePositive(amount, LendingErrorCode.ZERO_REPAY, "Repay amount must be greater than zero");

            AssetKind loanAsset = pool.getOrientation().depositAsset();
            if (custody.balanceOf(loanAsset, principal).signum() == 0) {
                throw new LendingException(LendingErrorCode.ZERO_REPAY, "No " + loanAsset + " balance to repay with");
            }

            BigInteger applied = amount.min(loan.getRepayAmount());
            requireBalance(loanAsset, principal, applied, LendingErrorCode.INSUFFICIENT_BALANCE);

            pullIn(ctx, loanAsset, principal, applied, LendingErrorCode.INSUFFICIENT_BALANCE);

            Loan updated = loan.repay(applied);
            writeLoan(ctx, poolId, principal, updated);
            writePool(ctx, pool.repay(applied));

            BigInteger released = BigInteger.ZERO;
            if (updated.isClosed()) {
                released = loan.getCollateralAmount();
                payOut(ctx, pool.getOrientation().collateralAsset(), principal, released);
                log.info("Loan fully repaid, collateral released: collateral={}", released);
            }

            ctx.emit(RepaidEvent.of(poolId, principal, applied, updated.getRepayAmount(), released, ctx.now()));
            log.info("Repayment booked: applied={}, remaining={}", applied, updated.getRepayAmount());
            return new RepaymentReceipt(poolId, principal, applied, updated.getRepayAmount(), released);
        });
    }

    /**
     * Closes a lapsed loan: the liquidator pays the discounted collateral value
     * and receives the collateral.
     *
     * @throws LendingException SELF_LIQUIDATION, NO_COLLATERAL, NOT_YET_LIQUIDATABLE,
     *         INSUFFICIENT_BALANCE, PRICE_UNAVAILABLE
     */
    public LiquidationReceipt liquidate(long poolId, String liquidator, String borrower) {
        return execute("liquidate", poolId, liquidator, ctx -> {
            if (liquidator.equals(borrower)) {
                throw new LendingException(LendingErrorCode.SELF_LIQUIDATION, "Borrowers cannot liquidate their own loan");
            }
            Pool pool = poolRegistry.require(poolId);
            Loan loan = loanLedger.get(poolId, borrower);
            if (!loan.isOpen()) {
                throw new LendingException(LendingErrorCode.NO_COLLATERAL, "Borrower has no collateral in pool " + poolId);
            }
            if (!loan.isLiquidatableAt(ctx.nowEpochSeconds())) {
                throw new LendingException(LendingErrorCode.NOT_YET_LIQUIDATABLE,
                    String.format("Loan is due at %d, now is %d", loan.dueAt(), ctx.nowEpochSeconds()));
            }

            BigInteger collateral = loan.getCollateralAmount();
            BigInteger payAmount = AccountingEngine.payoff(collateral, properties.getLiquidation().getDiscountRate(),
                pool.getOrientation(), ctx.rate(), assetScale);
            AssetKind loanAsset = pool.getOrientation().depositAsset();
            requireBalance(loanAsset, liquidator, payAmount, LendingErrorCode.INSUFFICIENT_BALANCE);

            BigInteger reserveDelta = saturatedReserveDelta(pool, AccountingEngine.liquidationReserveDelta(
                payAmount, loan.getRepayAmount(), loan.getBorrowedAmount(), loan.getInterestAmount(),
                loan.getFeeAmount()));

            pullIn(ctx, loanAsset, liquidator, payAmount, LendingErrorCode.INSUFFICIENT_BALANCE);
            writeLoan(ctx, poolId, borrower, Loan.CLOSED);
            writePool(ctx, pool.liquidate(payAmount, loan.getRepayAmount(), reserveDelta));
            payOut(ctx, pool.getOrientation().collateralAsset(), liquidator, collateral);

            ctx.emit(LiquidatedEvent.of(poolId, borrower, liquidator, payAmount, collateral,
                loan.getRepayAmount(), ctx.now()));
            log.info("Loan liquidated: borrower={}, collateral={}, payAmount={}, debtCleared={}, reserveDelta={}",
                borrower, collateral, payAmount, loan.getRepayAmount(), reserveDelta);
            return new LiquidationReceipt(poolId, borrower, liquidator, collateral, payAmount,
                loan.getRepayAmount(), reserveDelta);
        });
    }

    // ==================== Orchestration ====================

    private <T> T execute(String operation, long poolId, String principal, Function<OperationContext, T> body) {
        long startTime = System.currentTimeMillis();
        String outerPoolId = MDC.get(CorrelationContext.POOL_ID_MDC_KEY);
        String outerPrincipal = MDC.get(CorrelationContext.PRINCIPAL_MDC_KEY);
        MDC.put(CorrelationContext.POOL_ID_MDC_KEY, String.valueOf(poolId));
        MDC.put(CorrelationContext.PRINCIPAL_MDC_KEY, principal);

        try {
            if (principal == null || principal.isBlank()) {
                throw new LendingException(LendingErrorCode.INVALID_PARAMETER, "Calling principal is required");
            }
            log.debug("Starting {}", operation);

            OperationContext ctx = new OperationContext(clock.instant(), priceOracle);
            T result;
            try (ExecutionGuard.Permit permit = guard.acquire()) {
                try {
                    result = body.apply(ctx);
                    verifyInvariants(poolId);
                } catch (RuntimeException e) {
                    ctx.compensations().rollback(e);
                    throw e;
                }
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(operation, "success");
            metrics.recordLatency(operation, duration);
            log.info("{} completed: duration={}ms", operation, duration);

            ctx.events().forEach(this::publish);
            return result;

        } catch (LendingException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(operation, e.getCode().name());
            metrics.recordLatency(operation, duration);
            log.warn("{} rejected: code={}, message={}", operation, e.getCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(operation, "error");
            metrics.recordLatency(operation, duration);
            log.error("{} failed: error={}, duration={}ms", operation, e.getMessage(), duration, e);
            throw e;
        } finally {
            // a rejected re-entrant call must leave the outer operation's keys in place
            restoreMdc(CorrelationContext.POOL_ID_MDC_KEY, outerPoolId);
            restoreMdc(CorrelationContext.PRINCIPAL_MDC_KEY, outerPrincipal);
        }
    }

    private static void restoreMdc(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }

    private void publish(LendingEvent event) {
        try {
            eventPublisher.publish(event);
        } catch (RuntimeException e) {
            // Committed operations stay committed; the notification is lost
            log.error("Event publisher threw: eventId={}, eventType={}", event.getEventId(), event.getEventType(), e);
            metrics.recordEventPublishFailure(event.getEventType());
        }
    }

    private void verifyInvariants(long poolId) {
        Pool pool = poolRegistry.require(poolId);
        if (pool.totalLiquidity().signum() < 0) {
            throw new LendingException(LendingErrorCode.INVARIANT_VIOLATION,
                String.format("Pool %d total liquidity would be negative: borrow=%s, balance=%s, reserve=%s",
                    poolId, pool.getTotalBorrowAmount(), pool.getCurrentBalanceAmount(),
                    pool.getTotalReserveAmount()));
        }
    }

    private BigInteger saturatedReserveDelta(Pool pool, BigInteger reserveDelta) {
        BigInteger bounded = pool.boundedReserveDelta(reserveDelta);
        if (!bounded.equals(reserveDelta)) {
            log.warn("Liquidation reserve adjustment {} exceeds reserve {}; saturating at zero",
                reserveDelta, pool.getTotalReserveAmount());
        }
        return bounded;
    }

    // ==================== Ledger writes with undo ====================

    private void writePool(OperationContext ctx, Pool updated) {
        Pool previous = poolRegistry.require(updated.getId());
        poolRegistry.put(updated);
        ctx.compensations().record("restore pool " + updated.getId(), () -> poolRegistry.put(previous));
    }

    private void writeShares(OperationContext ctx, long poolId, String principal, BigInteger balance) {
        BigInteger previous = depositorLedger.sharesOf(poolId, principal);
        depositorLedger.setShares(poolId, principal, balance);
        ctx.compensations().record("restore shares of " + principal,
            () -> depositorLedger.setShares(poolId, principal, previous));
    }

    private void writeLoan(OperationContext ctx, long poolId, String principal, Loan loan) {
        Loan previous = loanLedger.get(poolId, principal);
        loanLedger.put(poolId, principal, loan);
        ctx.compensations().record("restore loan of " + principal,
            () -> loanLedger.put(poolId, principal, previous));
    }

    // ==================== Custody ====================

    private void requireBalance(AssetKind asset, String principal, BigInteger amount, LendingErrorCode code) {
        BigInteger available = custody.balanceOf(asset, principal);
        if (available.compareTo(amount) < 0) {
            throw new LendingException(code,
                String.format("%s balance %s is less than required %s", asset, available, amount));
        }
    }

    private void pullIn(OperationContext ctx, AssetKind asset, String from, BigInteger amount, LendingErrorCode code) {
        if (amount.signum() == 0) {
            return;
        }
        try {
            custody.transferIn(asset, from, amount);
        } catch (InsufficientFundsException e) {
            throw new LendingException(code, e.getMessage(), e);
        }
        ctx.compensations().record("refund " + amount + " " + asset + " to " + from,
            () -> custody.transferOut(asset, from, amount));
    }

    private void payOut(OperationContext ctx, AssetKind asset, String to, BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        try {
            custody.transferOut(asset, to, amount);
        } catch (InsufficientFundsException e) {
            throw new LendingException(LendingErrorCode.INVARIANT_VIOLATION,
                "Pool custody cannot cover a booked payout: " + e.getMessage(), e);
        }
        ctx.compensations().record("reclaim " + amount + " " + asset + " from " + to,
            () -> custody.transferIn(asset, to, amount));
    }

    private static void requirePositive(BigInteger amount, LendingErrorCode code, String message) {
        if (amount == null || amount.signum() == 0) {
            throw new LendingException(code, message);
        }
        if (amount.signum() < 0) {
            throw new LendingException(LendingErrorCode.INVALID_PARAMETER, "Amount must not be negative: " + amount);
        }
    }
}
