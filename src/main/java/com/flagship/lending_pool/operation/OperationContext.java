package com.flagship.lending_pool.operation;

import com.flagship.lending_pool.accounting.PriceRate;
import com.flagship.lending_pool.event.LendingEvent;
import com.flagship.lending_pool.oracle.PriceOracle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * State of one running operation: its clock reading, its single oracle read,
 * its undo log and the events to publish once it commits.
 */
class OperationContext {

    private final Instant now;
    private final PriceOracle priceOracle;
    private final CompensationLog compensations = new CompensationLog();
    private final List<LendingEvent> events = new ArrayList<>();
    private PriceRate rate;

    OperationContext(Instant now, PriceOracle priceOracle) {
        this.now = now;
        this.priceOracle = priceOracle;
    }

    Instant now() {
        return now;
    }

    long nowEpochSeconds() {
        return now.getEpochSecond();
    }

    /**
     * The oracle rate, read at most once per operation.
     */
    PriceRate rate() {
        if (rate == null) {
            rate = priceOracle.currentRate();
        }
        return rate;
    }

    CompensationLog compensations() {
        return compensations;
    }

    void emit(LendingEvent event) {
        events.add(event);
    }

    List<LendingEvent> events() {
        return events;
    }
}
