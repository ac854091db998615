package com.flagship.lending_pool.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;

/**
 * Lending configuration bound from {@code lending.*}.
 */
@ConfigurationProperties(prefix = "lending")
@Data
public class LendingProperties {

    /** Principal allowed to use the administrative endpoints. */
    private String owner = "owner";

    private Assets assets = new Assets();
    private Liquidation liquidation = new Liquidation();
    private Guard guard = new Guard();
    private Oracle oracle = new Oracle();

    @Data
    public static class Assets {
        private Asset a = new Asset(18);
        private Asset b = new Asset(6);
    }

    @Data
    public static class Asset {
        private int decimals;

        public Asset() {
        }

        public Asset(int decimals) {
            this.decimals = decimals;
        }
    }

    @Data
    public static class Liquidation {
        /** Percent of collateral value a liquidator pays. */
        private int discountRate = 95;
    }

    @Data
    public static class Guard {
        /** How long a caller on another thread waits for the running operation. */
        private long acquireTimeoutMs = 250;
    }

    @Data
    public static class Oracle {
        /** Asset B per asset A, fixed point with {@code rateDecimals} digits. Empty until set. */
        private BigInteger initialRate;
        private int rateDecimals = 8;
        /** 0 disables the staleness check. */
        private long maxAgeSeconds = 0;
    }
}
