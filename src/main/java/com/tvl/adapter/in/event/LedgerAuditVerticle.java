package com.tvl.adapter.in.event;

import com.tvl.adapter.out.event.EventBusLedgerEventPublisher;
import com.tvl.adapter.out.event.LedgerEventCodec;
import com.tvl.domain.event.LedgerEvent;
import com.tvl.domain.event.LedgerEventType;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.eventbus.MessageConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every ledger event to the audit log.
 * Events arrive in the order the ledgers applied them.
 */
public class LedgerAuditVerticle extends AbstractVerticle {
    private static final Logger log = LoggerFactory.getLogger(LedgerAuditVerticle.class);
    private static final Logger audit = LoggerFactory.getLogger("ledger.audit");

    private MessageConsumer<LedgerEvent> consumer;

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting Ledger Audit Verticle...");

        consumer = vertx.eventBus().consumer(EventBusLedgerEventPublisher.LEDGER_EVENT_ADDRESS, message -> {
            LedgerEvent event = message.body();
            if (event.getType() == LedgerEventType.ALLOCATION_REDUCTION_SKIPPED) {
                audit.warn("{}", LedgerEventCodec.toJson(event).encode());
            } else {
                audit.info("{}", LedgerEventCodec.toJson(event).encode());
            }
        });

        consumer.completionHandler(ar -> {
            if (ar.succeeded()) {
                log.info("Ledger Audit Verticle started successfully");
                startPromise.complete();
            } else {
                log.error("Failed to register ledger audit consumer", ar.cause());
                startPromise.fail(ar.cause());
            }
        });
    }

    @Override
    public void stop() {
        if (consumer != null) {
            consumer.unregister();
        }
        log.info("Ledger Audit Verticle stopped");
    }
}
