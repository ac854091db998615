package com.flagship.lending_pool.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lending_pool.accounting.AssetKind;
import com.flagship.lending_pool.accounting.AssetOrientation;
import com.flagship.lending_pool.pool.Pool;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Response DTO for a pool and its aggregates.
 */
@Value
@Builder
public class PoolResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("orientation")
    AssetOrientation orientation;

    @JsonProperty("deposit_asset")
    AssetKind depositAsset;

    @JsonProperty("collateral_asset")
    AssetKind collateralAsset;

    @JsonProperty("interest_rate")
    int interestRate;

    @JsonProperty("collateral_factor")
    int collateralFactor;

    @JsonProperty("reserve_fee_rate")
    int reserveFeeRate;

    @JsonProperty("total_borrow_amount")
    BigInteger totalBorrowAmount;

    @JsonProperty("total_asset_amount")
    BigInteger totalAssetAmount;

    @JsonProperty("total_reserve_amount")
    BigInteger totalReserveAmount;

    @JsonProperty("current_balance_amount")
    BigInteger currentBalanceAmount;

    @JsonProperty("total_liquidity")
    BigInteger totalLiquidity;

    @JsonProperty("depositor_count")
    long depositorCount;

    @JsonProperty("open_loan_count")
    long openLoanCount;

    public static PoolResponse from(Pool pool, long depositorCount, long openLoanCount) {
        return PoolResponse.builder()
            .id(pool.getId())
            .orientation(pool.getOrientation())
            .depositAsset(pool.getOrientation().depositAsset())
            .collateralAsset(pool.getOrientation().collateralAsset())
            .interestRate(pool.getParameters().getInterestRate())
            .collateralFactor(pool.getParameters().getCollateralFactor())
            .reserveFeeRate(pool.getParameters().getReserveFeeRate())
            .totalBorrowAmount(pool.getTotalBorrowAmount())
            .totalAssetAmount(pool.getTotalAssetAmount())
            .totalReserveAmount(pool.getTotalReserveAmount())
            .currentBalanceAmount(pool.getCurrentBalanceAmount())
            .totalLiquidity(pool.totalLiquidity())
            .depositorCount(depositorCount)
            .openLoanCount(openLoanCount)
            .build();
    }
}
