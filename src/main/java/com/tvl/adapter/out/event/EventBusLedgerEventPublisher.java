package com.tvl.adapter.out.event;

import com.tvl.application.port.out.LedgerEventPublisher;
import com.tvl.domain.event.LedgerEvent;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publisher for ledger events to the Vert.x event bus
 */
public class EventBusLedgerEventPublisher implements LedgerEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(EventBusLedgerEventPublisher.class);

    public static final String LEDGER_EVENT_ADDRESS = "ledger.events";

    private final Vertx vertx;

    public EventBusLedgerEventPublisher(Vertx vertx) {
        this.vertx = vertx;
    }

    @Override
    public void publish(LedgerEvent event) {
        log.debug("Publishing ledger event: {}", event);
        vertx.eventBus().publish(LEDGER_EVENT_ADDRESS, event);
    }
}
