package com.flagship.lending_pool.operation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LiquidateRequest {

    @NotBlank(message = "Borrower is required")
    @JsonProperty("borrower")
    private String borrower;
}
