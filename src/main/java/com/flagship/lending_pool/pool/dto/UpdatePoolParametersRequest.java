package com.flagship.lending_pool.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePoolParametersRequest {

    @Min(0)
    @Max(255)
    @JsonProperty("interest_rate")
    private int interestRate;

    @Min(0)
    @Max(255)
    @JsonProperty("collateral_factor")
    private int collateralFactor;

    @Min(0)
    @Max(255)
    @JsonProperty("reserve_fee_rate")
    private int reserveFeeRate;
}
