package com.flagship.lending_pool.config;

import com.flagship.lending_pool.accounting.AssetScale;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core beans shared by the operation handlers.
 */
@Configuration
@EnableConfigurationProperties(LendingProperties.class)
public class LendingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AssetScale assetScale(LendingProperties properties) {
        return new AssetScale(
            properties.getAssets().getA().getDecimals(),
            properties.getAssets().getB().getDecimals()
        );
    }
}
