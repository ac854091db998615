package com.flagship.lending_pool.oracle;

import com.flagship.lending_pool.accounting.PriceRate;
import com.flagship.lending_pool.config.LendingProperties;
import com.flagship.lending_pool.exception.LendingErrorCode;
import com.flagship.lending_pool.exception.LendingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Price oracle adapter fed by an external price source through {@link #updateRate}.
 *
 * Price discovery happens elsewhere; this adapter only holds the last pushed
 * rate and refuses to serve it once it is older than the configured max age.
 */
@Component
@Slf4j
public class ConfiguredPriceOracle implements PriceOracle {

    private final AtomicReference<PriceRate> latest = new AtomicReference<>();
    private final Clock clock;
    private final int rateDecimals;
    private final Duration maxAge;

    public ConfiguredPriceOracle(LendingProperties properties, Clock clock) {
        this.clock = clock;
        this.rateDecimals = properties.getOracle().getRateDecimals();
        long maxAgeSeconds = properties.getOracle().getMaxAgeSeconds();
        this.maxAge = maxAgeSeconds > 0 ? Duration.ofSeconds(maxAgeSeconds) : null;
        if (properties.getOracle().getInitialRate() != null) {
            updateRate(properties.getOracle().getInitialRate());
        }
    }

    @Override
    public PriceRate currentRate() {
        PriceRate rate = latest.get();
        if (rate == null) {
            throw new LendingException(LendingErrorCode.PRICE_UNAVAILABLE, "No price rate has been published");
        }
        if (maxAge != null && rate.getObservedAt().plus(maxAge).isBefore(clock.instant())) {
            throw new LendingException(LendingErrorCode.PRICE_UNAVAILABLE,
                String.format("Price rate is stale: observedAt=%s, maxAge=%s", rate.getObservedAt(), maxAge));
        }
        return rate;
    }

    /**
     * Publishes a new rate (asset B per asset A, fixed point).
     */
    public PriceRate updateRate(BigInteger value) {
        if (value == null || value.signum() <= 0) {
            throw new LendingException(LendingErrorCode.INVALID_PARAMETER, "Price rate must be positive");
        }
        Instant now = clock.instant();
        PriceRate rate = new PriceRate(value, rateDecimals, now);
        latest.set(rate);
        log.info("Price rate updated: value={}, decimals={}, observedAt={}", value, rateDecimals, now);
        return rate;
    }
}
