package com.flagship.lending_pool.operation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

/**
 * A depositor's shares and what a full withdrawal would currently pay.
 */
@Value
public class DepositorResponse {

    @JsonProperty("pool_id")
    long poolId;

    @JsonProperty("principal")
    String principal;

    @JsonProperty("share_balance")
    BigInteger shareBalance;

    @JsonProperty("redeemable_amount")
    BigInteger redeemableAmount;
}
