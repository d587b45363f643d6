package com.tvl.adapter.in.web.admin;

import com.tvl.adapter.in.web.dto.ApiResponder;
import com.tvl.adapter.in.web.dto.RequestParsing;
import com.tvl.domain.exception.LedgerException;
import com.tvl.domain.model.Address;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Function;

/**
 * Pause and unpause endpoints for one ledger
 */
@Slf4j
@RequiredArgsConstructor
public class PauseHandler {

    private final String ledger;
    private final Function<Address, Future<Void>> pauseOperation;
    private final Function<Address, Future<Void>> unpauseOperation;

    public void pause(RoutingContext context) {
        apply(context, pauseOperation, true);
    }

    public void unpause(RoutingContext context) {
        apply(context, unpauseOperation, false);
    }

    private void apply(RoutingContext context, Function<Address, Future<Void>> operation, boolean paused) {
        try {
            Address caller = RequestParsing.caller(context);
            log.info("{} requested {} of the {} ledger", caller, paused ? "pause" : "unpause", ledger);
            operation.apply(caller)
                    .onSuccess(v -> ApiResponder.success(context, 200, new JsonObject()
                            .put("ledger", ledger)
                            .put("paused", paused)))
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException e) {
            ApiResponder.failure(context, e);
        }
    }
}
