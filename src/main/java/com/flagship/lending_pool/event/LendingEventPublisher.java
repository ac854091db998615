package com.flagship.lending_pool.event;

/**
 * Notification collaborator. Called after an operation commits; must not throw
 * back into the ledger.
 */
public interface LendingEventPublisher {

    void publish(LendingEvent event);
}
