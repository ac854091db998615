package com.flagship.lending_pool.pool;

import com.flagship.lending_pool.accounting.AssetOrientation;
import com.flagship.lending_pool.accounting.PriceRate;
import com.flagship.lending_pool.config.LendingProperties;
import com.flagship.lending_pool.exception.LendingErrorCode;
import com.flagship.lending_pool.exception.LendingException;
import com.flagship.lending_pool.observability.LendingMetrics;
import com.flagship.lending_pool.operation.ExecutionGuard;
import com.flagship.lending_pool.oracle.ConfiguredPriceOracle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Owner-only administration: listing pools, changing risk parameters and
 * publishing the oracle rate.
 *
 * Changes run under the execution guard, so they land between operations
 * and never in the middle of one.
 */
@Service
@Slf4j
public class PoolAdminService {

    private final PoolRegistry poolRegistry;
    private final ExecutionGuard guard;
    private final ConfiguredPriceOracle priceOracle;
    private final LendingProperties properties;

    public PoolAdminService(PoolRegistry poolRegistry,
                            ExecutionGuard guard,
                            ConfiguredPriceOracle priceOracle,
                            LendingProperties properties,
                            LendingMetrics metrics) {
        this.poolRegistry = poolRegistry;
        this.guard = guard;
        this.priceOracle = priceOracle;
        this.properties = properties;
        metrics.registerPoolCountGauge(poolRegistry::count);
    }

    public Pool createPool(String caller, AssetOrientation orientation, PoolParameters parameters) {
        requireOwner(caller);
        try (ExecutionGuard.Permit permit = guard.acquire()) {
            Pool pool = poolRegistry.create(orientation, parameters);
            log.info("Pool created: poolId={}, orientation={}, parameters={}", pool.getId(), orientation, parameters);
            return pool;
        }
    }

    public Pool updateParameters(String caller, long poolId, PoolParameters parameters) {
        requireOwner(caller);
        try (ExecutionGuard.Permit permit = guard.acquire()) {
            Pool pool = poolRegistry.require(poolId);
            Pool updated = pool.withParameters(parameters);
            poolRegistry.put(updated);
            log.info("Pool parameters updated: poolId={}, from={}, to={}", poolId, pool.getParameters(), parameters);
            return updated;
        }
    }

    public PriceRate updateOracleRate(String caller, BigInteger rate) {
        requireOwner(caller);
        try (ExecutionGuard.Permit permit = guard.acquire()) {
            return priceOracle.updateRate(rate);
        }
    }

    public void requireOwner(String caller) {
        if (caller == null || !caller.equals(properties.getOwner())) {
            throw new LendingException(LendingErrorCode.NOT_OWNER, "Only the pool owner may do this");
        }
    }
}
