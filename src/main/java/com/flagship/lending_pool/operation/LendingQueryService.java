package com.flagship.lending_pool.operation;

import com.flagship.lending_pool.accounting.AccountingEngine;
import com.flagship.lending_pool.accounting.AssetScale;
import com.flagship.lending_pool.accounting.LoanTerms;
import com.flagship.lending_pool.config.LendingProperties;
import com.flagship.lending_pool.exception.LendingErrorCode;
import com.flagship.lending_pool.exception.LendingException;
import com.flagship.lending_pool.ledger.DepositorLedger;
import com.flagship.lending_pool.ledger.Loan;
import com.flagship.lending_pool.ledger.LoanLedger;
import com.flagship.lending_pool.ledger.LoanStatus;
import com.flagship.lending_pool.oracle.PriceOracle;
import com.flagship.lending_pool.pool.Pool;
import com.flagship.lending_pool.pool.PoolRegistry;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;

/**
 * Read-only views and quotes. Reads never take the execution guard.
 *
 * They are not isolated from a running operation: ledger writes become
 * visible as they are made, and a rollback reverts them. Each value read is
 * internally consistent; two values read one after the other may straddle
 * an operation.
 */
@Service
public class LendingQueryService {

    private final PoolRegistry poolRegistry;
    private final DepositorLedger depositorLedger;
    private final LoanLedger loanLedger;
    private final PriceOracle priceOracle;
    private final AssetScale assetScale;
    private final LendingProperties properties;
    private final Clock clock;

    public LendingQueryService(PoolRegistry poolRegistry,
                               DepositorLedger depositorLedger,
                               LoanLedger loanLedger,
                               PriceOracle priceOracle,
                               AssetScale assetScale,
                               LendingProperties properties,
                               Clock clock) {
        this.poolRegistry = poolRegistry;
        this.depositorLedger = depositorLedger;
        this.loanLedger = loanLedger;
        this.priceOracle = priceOracle;
        this.assetScale = assetScale;
        this.properties = properties;
        this.clock = clock;
    }

    public Pool getPool(long poolId) {
        return poolRegistry.require(poolId);
    }

    public List<Pool> listPools() {
        return poolRegistry.findAll();
    }

    public Loan getLoan(long poolId, String principal) {
        poolRegistry.require(poolId);
        return loanLedger.get(poolId, principal);
    }

    public LoanStatus loanStatus(Loan loan) {
        return loan.statusAt(clock.instant().getEpochSecond());
    }

    public BigInteger sharesOf(long poolId, String principal) {
        poolRegistry.require(poolId);
        return depositorLedger.sharesOf(poolId, principal);
    }

    public long depositorCount(long poolId) {
        return depositorLedger.countDepositors(poolId);
    }

    public long openLoanCount(long poolId) {
        return loanLedger.countOpen(poolId);
    }

    /**
     * What a full withdrawal would pay right now, ignoring the available-balance check.
     */
    public BigInteger redeemableAmount(long poolId, String principal) {
        Pool pool = poolRegistry.require(poolId);
        BigInteger shares = depositorLedger.sharesOf(poolId, principal);
        if (pool.getTotalAssetAmount().signum() == 0) {
            // shares seen before the pool that issues them
            return BigInteger.ZERO;
        }
        return AccountingEngine.toAmount(shares, pool.totalLiquidity(), pool.getTotalAssetAmount());
    }

    /**
     * Terms a borrow of {@code collateralAmount} for {@code durationSeconds} would get at the current rate.
     */
    public LoanTerms quoteBorrow(long poolId, BigInteger collateralAmount, long durationSeconds) {
        if (collateralAmount == null || collateralAmount.signum() < 0 || durationSeconds < 0) {
            throw new LendingException(LendingErrorCode.INVALID_PARAMETER,
                "Collateral amount and duration must not be negative");
        }
        Pool pool = poolRegistry.require(poolId);
        return AccountingEngine.quoteLoan(
            collateralAmount,
            durationSeconds,
            pool.getParameters().getCollateralFactor(),
            pool.getParameters().getInterestRate(),
            pool.getParameters().getReserveFeeRate(),
            pool.getOrientation(),
            priceOracle.currentRate(),
            assetScale);
    }

    /**
     * Amount a liquidator would pay for the borrower's collateral at the current rate.
     * Depends only on the loan's collateral amount.
     */
    public BigInteger getPayoffQuote(long poolId, String borrower) {
        Pool pool = poolRegistry.require(poolId);
        Loan loan = loanLedger.get(poolId, borrower);
        return AccountingEngine.payoff(loan.getCollateralAmount(), properties.getLiquidation().getDiscountRate(),
            pool.getOrientation(), priceOracle.currentRate(), assetScale);
    }
}
