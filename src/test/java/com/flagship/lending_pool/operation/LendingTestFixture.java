package com.flagship.lending_pool.operation;

import com.flagship.lending_pool.MutableClock;
import com.flagship.lending_pool.accounting.AssetKind;
import com.flagship.lending_pool.accounting.AssetOrientation;
import com.flagship.lending_pool.accounting.AssetScale;
import com.flagship.lending_pool.config.LendingProperties;
import com.flagship.lending_pool.custody.AssetCustody;
import com.flagship.lending_pool.custody.InMemoryAssetCustody;
import com.flagship.lending_pool.event.LendingEvent;
import com.flagship.lending_pool.event.LendingEventPublisher;
import com.flagship.lending_pool.ledger.DepositorLedger;
import com.flagship.lending_pool.ledger.LoanLedger;
import com.flagship.lending_pool.observability.LendingMetrics;
import com.flagship.lending_pool.oracle.ConfiguredPriceOracle;
import com.flagship.lending_pool.pool.Pool;
import com.flagship.lending_pool.pool.PoolAdminService;
import com.flagship.lending_pool.pool.PoolParameters;
import com.flagship.lending_pool.pool.PoolRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Wires the lending services by hand, without a Spring context.
 *
 * Both assets use 0 decimals and the oracle rate has 0 fractional digits,
 * so a rate of 2 means 2 B per A and amounts read as plain integers.
 */
class LendingTestFixture {

    static final String OWNER = "owner";
    static final long START = 1_700_000_000L;
    static final long DAY = 86_400L;

    final MutableClock clock = new MutableClock(Instant.ofEpochSecond(START));
    final LendingProperties properties = new LendingProperties();
    final PoolRegistry poolRegistry = new PoolRegistry();
    final DepositorLedger depositorLedger = new DepositorLedger();
    final LoanLedger loanLedger = new LoanLedger();
    final InMemoryAssetCustody vault = new InMemoryAssetCustody();
    final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    final LendingMetrics metrics = new LendingMetrics(meterRegistry);
    final ExecutionGuard guard = new ExecutionGuard(50);
    final List<LendingEvent> published = new ArrayList<>();
    volatile boolean failPublishing;
    final AssetScale scale = new AssetScale(0, 0);
    final ConfiguredPriceOracle oracle;
    final PoolAdminService admin;
    final LendingPoolService service;
    final LendingQueryService queries;

    LendingTestFixture() {
        this(custody -> custody);
    }

    LendingTestFixture(Function<AssetCustody, AssetCustody> custodyDecorator) {
        this(custodyDecorator, BigInteger.TWO);
    }

    /**
     * @param custodyDecorator wraps the in-memory custody, e.g. to inject callbacks or failures
     * @param initialRate oracle rate at start, or null for an oracle that has no rate yet
     */
    LendingTestFixture(Function<AssetCustody, AssetCustody> custodyDecorator, BigInteger initialRate) {
        properties.setOwner(OWNER);
        properties.getOracle().setRateDecimals(0);
        properties.getOracle().setInitialRate(initialRate);
        oracle = new ConfiguredPriceOracle(properties, clock);
        admin = new PoolAdminService(poolRegistry, guard, oracle, properties, metrics);
        LendingEventPublisher publisher = event -> {
            if (failPublishing) {
                throw new IllegalStateException("broker unavailable");
            }
            published.add(event);
        };
        service = new LendingPoolService(poolRegistry, depositorLedger, loanLedger, oracle,
            custodyDecorator.apply(vault), guard, publisher, metrics, scale, properties, clock);
        queries = new LendingQueryService(poolRegistry, depositorLedger, loanLedger, oracle, scale, properties, clock);
    }

    /**
     * Pool lending B against A collateral.
     */
    long createPool(int interestRate, int collateralFactor, int reserveFeeRate) {
        return createPool(AssetOrientation.ASSET_A_AS_COLLATERAL, interestRate, collateralFactor, reserveFeeRate);
    }

    long createPool(AssetOrientation orientation, int interestRate, int collateralFactor, int reserveFeeRate) {
        Pool pool = admin.createPool(OWNER, orientation,
            new PoolParameters(interestRate, collateralFactor, reserveFeeRate));
        return pool.getId();
    }

    void fund(AssetKind kind, String principal, long amount) {
        vault.credit(kind, principal, BigInteger.valueOf(amount));
    }

    BigInteger balance(AssetKind kind, String principal) {
        return vault.balanceOf(kind, principal);
    }

    Pool pool(long poolId) {
        return poolRegistry.require(poolId);
    }

    double operationCount(String operation, String outcome) {
        var counter = meterRegistry.find("lending.operations")
            .tag("operation", operation)
            .tag("outcome", outcome)
            .counter();
        return counter == null ? 0 : counter.count();
    }

    static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }
}
