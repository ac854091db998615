package com.flagship.lending_pool.operation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Request DTO for opening a loan. Zero collateral reaches the ledger and is
 * rejected there with ZERO_COLLATERAL.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BorrowRequest {

    @NotNull(message = "Collateral amount is required")
    @PositiveOrZero(message = "Collateral amount must not be negative")
    @JsonProperty("collateral_amount")
    private BigInteger collateralAmount;

    @Positive(message = "Duration must be positive")
    @JsonProperty("duration_seconds")
    private long durationSeconds;
}
