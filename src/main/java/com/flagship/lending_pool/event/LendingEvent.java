package com.flagship.lending_pool.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for lending notifications.
 *
 * Events are facts about committed operations: they are published only
 * after the operation's ledger changes and transfers have all applied.
 */
public interface LendingEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    long getPoolId();

    /**
     * The principal whose position the event is about.
     */
    String getPrincipal();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
