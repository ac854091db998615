package com.flagship.lending_pool.operation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RepayRequest {

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount must not be negative")
    @JsonProperty("amount")
    private BigInteger amount;
}
