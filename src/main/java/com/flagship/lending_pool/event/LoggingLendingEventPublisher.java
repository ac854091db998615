package com.flagship.lending_pool.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Default publisher when Kafka is off: writes each event to the log.
 */
@Component
@ConditionalOnProperty(name = "events.kafka.enabled", havingValue = "false", matchIfMissing = true)
@Slf4j
public class LoggingLendingEventPublisher implements LendingEventPublisher {

    @Override
    public void publish(LendingEvent event) {
        log.info("Lending event: type={}, eventId={}, poolId={}, principal={}, event={}",
                event.getEventType(), event.getEventId(), event.getPoolId(), event.getPrincipal(), event);
    }
}
