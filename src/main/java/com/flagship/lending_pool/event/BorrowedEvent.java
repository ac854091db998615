package com.flagship.lending_pool.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a loan is originated.
 */
@Value
public class BorrowedEvent implements LendingEvent {
    public static final String EVENT_TYPE = "Borrowed";

    UUID eventId;
    long poolId;
    String principal;
    BigInteger collateralAmount;
    BigInteger borrowedAmount;
    BigInteger repayAmount;
    long durationSeconds;
    Instant occurredAt;

    public static BorrowedEvent of(long poolId, String principal, BigInteger collateralAmount,
                                   BigInteger borrowedAmount, BigInteger repayAmount,
                                   long durationSeconds, Instant at) {
        return new BorrowedEvent(UUID.randomUUID(), poolId, principal, collateralAmount,
            borrowedAmount, repayAmount, durationSeconds, at);
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
