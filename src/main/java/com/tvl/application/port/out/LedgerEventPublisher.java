package com.tvl.application.port.out;

import com.tvl.domain.event.LedgerEvent;

/**
 * Output port for ledger events
 */
@FunctionalInterface
public interface LedgerEventPublisher {

    void publish(LedgerEvent event);
}
