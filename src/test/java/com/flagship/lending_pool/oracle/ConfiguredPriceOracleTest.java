package com.flagship.lending_pool.oracle;

import com.flagship.lending_pool.MutableClock;
import com.flagship.lending_pool.config.LendingProperties;
import com.flagship.lending_pool.exception.LendingErrorCode;
import com.flagship.lending_pool.exception.LendingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ConfiguredPriceOracleTest {

    private final MutableClock clock = new MutableClock(Instant.ofEpochSecond(1_700_000_000L));

    @Test
    @DisplayName("No rate published means the price is unavailable")
    void testNoRate() {
        ConfiguredPriceOracle oracle = new ConfiguredPriceOracle(new LendingProperties(), clock);

        LendingException e = assertThrows(LendingException.class, oracle::currentRate);
        assertEquals(LendingErrorCode.PRICE_UNAVAILABLE, e.getCode());
    }

    @Test
    @DisplayName("Initial rate from configuration is served with the configured decimals")
    void testInitialRate() {
        LendingProperties properties = new LendingProperties();
        properties.getOracle().setInitialRate(BigInteger.valueOf(123));
        properties.getOracle().setRateDecimals(2);

        ConfiguredPriceOracle oracle = new ConfiguredPriceOracle(properties, clock);

        assertEquals(BigInteger.valueOf(123), oracle.currentRate().getValue());
        assertEquals(2, oracle.currentRate().getDecimals());
        assertEquals(clock.instant(), oracle.currentRate().getObservedAt());
    }

    @Test
    @DisplayName("A rate older than the max age is refused until refreshed")
    void testStaleRate() {
        LendingProperties properties = new LendingProperties();
        properties.getOracle().setInitialRate(BigInteger.TEN);
        properties.getOracle().setMaxAgeSeconds(60);
        ConfiguredPriceOracle oracle = new ConfiguredPriceOracle(properties, clock);

        clock.advance(Duration.ofSeconds(60));
        assertDoesNotThrow(oracle::currentRate);

        clock.advance(Duration.ofSeconds(1));
        LendingException e = assertThrows(LendingException.class, oracle::currentRate);
        assertEquals(LendingErrorCode.PRICE_UNAVAILABLE, e.getCode());

        oracle.updateRate(BigInteger.TWO);
        assertEquals(BigInteger.TWO, oracle.currentRate().getValue());
    }

    @Test
    @DisplayName("Zero and negative rates are rejected")
    void testInvalidRate() {
        ConfiguredPriceOracle oracle = new ConfiguredPriceOracle(new LendingProperties(), clock);

        LendingException e = assertThrows(LendingException.class, () -> oracle.updateRate(BigInteger.ZERO));
        assertEquals(LendingErrorCode.INVALID_PARAMETER, e.getCode());
        assertThrows(LendingException.class, () -> oracle.updateRate(BigInteger.valueOf(-1)));
    }
}
