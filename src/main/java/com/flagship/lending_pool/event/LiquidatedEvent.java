package com.flagship.lending_pool.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a lapsed loan is closed by a third party.
 * {@code principal} is the borrower; {@code liquidator} paid the payoff.
 */
@Value
public class LiquidatedEvent implements LendingEvent {
    public static final String EVENT_TYPE = "Liquidated";

    UUID eventId;
    long poolId;
    String principal;
    String liquidator;
    BigInteger payAmount;
    BigInteger collateralAmount;
    BigInteger debtCleared;
    Instant occurredAt;

    public static LiquidatedEvent of(long poolId, String borrower, String liquidator, BigInteger payAmount,
                                     BigInteger collateralAmount, BigInteger debtCleared, Instant at) {
        return new LiquidatedEvent(UUID.randomUUID(), poolId, borrower, liquidator, payAmount,
            collateralAmount, debtCleared, at);
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
