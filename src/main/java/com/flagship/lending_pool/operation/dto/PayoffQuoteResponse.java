package com.flagship.lending_pool.operation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

@Value
public class PayoffQuoteResponse {

    @JsonProperty("pool_id")
    long poolId;

    @JsonProperty("borrower")
    String borrower;

    @JsonProperty("pay_amount")
    BigInteger payAmount;
}
