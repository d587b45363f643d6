package com.tvl.adapter.out.ledger;

import com.tvl.domain.exception.LedgerException;
import io.vertx.core.Future;

/**
 * Unwraps the already-completed futures returned by the in-process ledgers.
 */
final class CompletedFutures {

    private CompletedFutures() {
    }

    static <T> T await(Future<T> future) {
        if (!future.isComplete()) {
            throw new IllegalStateException("Ledger call did not complete synchronously");
        }
        if (future.succeeded()) {
            return future.result();
        }
        Throwable cause = future.cause();
        if (cause instanceof LedgerException ledgerException) {
            throw ledgerException;
        }
        if (cause instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
        throw new IllegalStateException("Ledger call failed", cause);
    }
}
