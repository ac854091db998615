package com.flagship.lending_pool.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published for every repayment. {@code collateralReleased} is non-zero only
 * on the repayment that closes the loan.
 */
@Value
public class RepaidEvent implements LendingEvent {
    public static final String EVENT_TYPE = "Repaid";

    UUID eventId;
    long poolId;
    String principal;
    BigInteger amount;
    BigInteger remainingAmount;
    BigInteger collateralReleased;
    Instant occurredAt;

    public static RepaidEvent of(long poolId, String principal, BigInteger amount, BigInteger remainingAmount,
                                 BigInteger collateralReleased, Instant at) {
        return new RepaidEvent(UUID.randomUUID(), poolId, principal, amount, remainingAmount,
            collateralReleased, at);
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
