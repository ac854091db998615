package com.flagship.lending_pool.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lending_pool.accounting.AssetOrientation;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for listing a new pool.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreatePoolRequest {

    @NotNull(message = "Orientation is required")
    @JsonProperty("orientation")
    private AssetOrientation orientation;

    @Min(value = 0, message = "Interest rate must be between 0 and 255")
    @Max(value = 255, message = "Interest rate must be between 0 and 255")
    @JsonProperty("interest_rate")
    private int interestRate;

    @Min(value = 0, message = "Collateral factor must be between 0 and 255")
    @Max(value = 255, message = "Collateral factor must be between 0 and 255")
    @JsonProperty("collateral_factor")
    private int collateralFactor;

    @Min(value = 0, message = "Reserve fee rate must be between 0 and 255")
    @Max(value = 255, message = "Reserve fee rate must be between 0 and 255")
    @JsonProperty("reserve_fee_rate")
    private int reserveFeeRate;
}
