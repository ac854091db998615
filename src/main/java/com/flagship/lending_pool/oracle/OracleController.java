package com.flagship.lending_pool.oracle;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lending_pool.accounting.PriceRate;
import com.flagship.lending_pool.pool.PoolAdminService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * Reads the current rate and lets the owner push a new one.
 */
@RestController
@RequestMapping("/api/oracle")
@RequiredArgsConstructor
public class OracleController {

    private final PriceOracle priceOracle;
    private final PoolAdminService adminService;

    @GetMapping("/rate")
    public PriceRate currentRate() {
        return priceOracle.currentRate();
    }

    @PutMapping("/rate")
    public PriceRate updateRate(@Valid @RequestBody RateRequest request,
                                @RequestHeader("X-Principal-Id") String principal) {
        return adminService.updateOracleRate(principal, request.getValue());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RateRequest {
        @NotNull(message = "Rate value is required")
        @JsonProperty("value")
        private BigInteger value;
    }
}
