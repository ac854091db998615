package com.flagship.lending_pool.operation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lending_pool.accounting.LoanTerms;
import lombok.Value;

import java.math.BigInteger;

@Value
public class BorrowQuoteResponse {

    @JsonProperty("borrowable")
    BigInteger borrowable;

    @JsonProperty("interest_amount")
    BigInteger interestAmount;

    @JsonProperty("fee_amount")
    BigInteger feeAmount;

    @JsonProperty("repay_amount")
    BigInteger repayAmount;

    public static BorrowQuoteResponse from(LoanTerms terms) {
        return new BorrowQuoteResponse(terms.getBorrowable(), terms.getInterestAmount(),
            terms.getFeeAmount(), terms.getRepayAmount());
    }
}
