package com.flagship.lending_pool.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

@Value
public class WithdrawnEvent implements LendingEvent {
    public static final String EVENT_TYPE = "Withdrawn";

    UUID eventId;
    long poolId;
    String principal;
    BigInteger amount;
    BigInteger shares;
    Instant occurredAt;

    public static WithdrawnEvent of(long poolId, String principal, BigInteger amount, BigInteger shares, Instant at) {
        return new WithdrawnEvent(UUID.randomUUID(), poolId, principal, amount, shares, at);
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
