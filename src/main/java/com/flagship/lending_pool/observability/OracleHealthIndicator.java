package com.flagship.lending_pool.observability;

import com.flagship.lending_pool.accounting.PriceRate;
import com.flagship.lending_pool.exception.LendingException;
import com.flagship.lending_pool.oracle.PriceOracle;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of the price feed. Borrow and liquidate cannot run without a rate,
 * so a missing or stale rate reports DOWN; deposits and repayments still work.
 */
@Component("oracleHealth")
public class OracleHealthIndicator implements HealthIndicator {

    private final PriceOracle priceOracle;

    public OracleHealthIndicator(PriceOracle priceOracle) {
        this.priceOracle = priceOracle;
    }

    @Override
    public Health health() {
        try {
            PriceRate rate = priceOracle.currentRate();
            return Health.up()
                    .withDetail("rate", rate.getValue().toString())
                    .withDetail("decimals", rate.getDecimals())
                    .withDetail("observedAt", rate.getObservedAt().toString())
                    .build();
        } catch (LendingException e) {
            return Health.down()
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
