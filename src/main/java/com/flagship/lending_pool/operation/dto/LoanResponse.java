package com.flagship.lending_pool.operation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lending_pool.ledger.Loan;
import com.flagship.lending_pool.ledger.LoanStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class LoanResponse {

    @JsonProperty("pool_id")
    long poolId;

    @JsonProperty("principal")
    String principal;

    @JsonProperty("status")
    LoanStatus status;

    @JsonProperty("collateral_amount")
    BigInteger collateralAmount;

    @JsonProperty("borrowed_amount")
    BigInteger borrowedAmount;

    @JsonProperty("repay_amount")
    BigInteger repayAmount;

    @JsonProperty("interest_amount")
    BigInteger interestAmount;

    @JsonProperty("fee_amount")
    BigInteger feeAmount;

    @JsonProperty("start_time")
    long startTime;

    @JsonProperty("duration")
    long duration;

    public static LoanResponse from(long poolId, String principal, Loan loan, LoanStatus status) {
        return LoanResponse.builder()
            .poolId(poolId)
            .principal(principal)
            .status(status)
            .collateralAmount(loan.getCollateralAmount())
            .borrowedAmount(loan.getBorrowedAmount())
            .repayAmount(loan.getRepayAmount())
            .interestAmount(loan.getInterestAmount())
            .feeAmount(loan.getFeeAmount())
            .startTime(loan.getStartTime())
            .duration(loan.getDuration())
            .build();
    }
}
