package com.tvl.adapter.in.web.dto;

import com.tvl.domain.exception.ErrorCategory;
import com.tvl.domain.exception.LedgerException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes JSON success and error responses.
 * Ledger failures map to an HTTP status by error category.
 */
@Slf4j
public final class ApiResponder {

    private ApiResponder() {
    }

    public static void success(RoutingContext context, int statusCode, JsonObject data) {
        JsonObject response = new JsonObject()
                .put("status", "success")
                .put("data", data);
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(response.encode());
    }

    public static void failure(RoutingContext context, Throwable error) {
        if (error instanceof LedgerException ledgerException) {
            JsonObject response = new JsonObject()
                    .put("status", "error")
                    .put("code", ledgerException.getCode().name())
                    .put("category", ledgerException.getCategory().name())
                    .put("message", ledgerException.getMessage());
            context.response()
                    .setStatusCode(statusFor(ledgerException.getCategory()))
                    .putHeader("Content-Type", "application/json")
                    .end(response.encode());
            return;
        }
        if (error instanceof IllegalArgumentException) {
            sendError(context, 400, error.getMessage());
            return;
        }
        log.error("Unexpected failure on {} {}", context.request().method(), context.request().path(), error);
        sendError(context, 500, "Internal error");
    }

    public static void sendError(RoutingContext context, int statusCode, String message) {
        JsonObject response = new JsonObject()
                .put("status", "error")
                .put("message", message);
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(response.encode());
    }

    public static int statusFor(ErrorCategory category) {
        return switch (category) {
            case AUTHORIZATION -> 403;
            case INVALID_INPUT -> 400;
            case INVALID_REFERENCE -> 404;
            case STATE_CONFLICT -> 409;
            case SYSTEM_HALTED -> 503;
        };
    }
}
