package com.flagship.lending_pool.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

@Value
public class DepositedEvent implements LendingEvent {
    public static final String EVENT_TYPE = "Deposited";

    UUID eventId;
    long poolId;
    String principal;
    BigInteger amount;
    BigInteger shares;
    Instant occurredAt;

    public static DepositedEvent of(long poolId, String principal, BigInteger amount, BigInteger shares, Instant at) {
        return new DepositedEvent(UUID.randomUUID(), poolId, principal, amount, shares, at);
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
