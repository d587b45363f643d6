package com.tvl.adapter.in.web;

import com.tvl.adapter.in.web.admin.PauseHandler;
import com.tvl.adapter.in.web.admin.RoleHandler;
import com.tvl.adapter.in.web.allocation.AirdropHandler;
import com.tvl.adapter.in.web.allocation.AllocationHandler;
import com.tvl.adapter.in.web.allocation.ManagerHandler;
import com.tvl.adapter.in.web.vesting.VestingQueryHandler;
import com.tvl.adapter.in.web.vesting.VestingScheduleHandler;
import com.tvl.adapter.out.event.EventBusLedgerEventPublisher;
import com.tvl.application.service.AllocationLedgerService;
import com.tvl.application.service.VestingEngineService;
import com.tvl.infrastructure.config.LedgerConfig;
import com.tvl.infrastructure.config.LedgerContext;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.LoggerHandler;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * HTTP Server Verticle - handles all HTTP requests
 * Wires the ledgers from the deployment config and exposes them over HTTP
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private LedgerConfig ledgerConfig;
    private LedgerContext ledgerContext;

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        initializeLedgers()
                .compose(v -> {
                    log.info("Ledgers initialized successfully");
                    return startHttpServer();
                })
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", ledgerConfig.getHttpPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        log.info("HTTP Server Verticle stopped");
    }

    private Future<Void> initializeLedgers() {
        try {
            ledgerConfig = LedgerConfig.fromJson(config());
            ledgerContext = LedgerContext.create(
                    ledgerConfig,
                    new EventBusLedgerEventPublisher(vertx),
                    Clock.systemUTC()
            );
            return Future.succeededFuture();
        } catch (Exception e) {
            log.error("Error initializing ledgers", e);
            return Future.failedFuture(e);
        }
    }

    private Future<Void> startHttpServer() {
        AllocationLedgerService allocationLedger = ledgerContext.getAllocationLedger();
        VestingEngineService vestingEngine = ledgerContext.getVestingEngine();

        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());
        router.route().handler(BodyHandler.create());

        // Setup routes
        WebRouter.builder()
                .router(router)
                .allocationHandler(new AllocationHandler(allocationLedger, allocationLedger))
                .airdropHandler(new AirdropHandler(allocationLedger))
                .managerHandler(new ManagerHandler(allocationLedger, allocationLedger))
                .vestingScheduleHandler(new VestingScheduleHandler(vestingEngine))
                .vestingQueryHandler(new VestingQueryHandler(vestingEngine))
                .allocationPauseHandler(new PauseHandler("allocation", allocationLedger::pause, allocationLedger::unpause))
                .vestingPauseHandler(new PauseHandler("vesting", vestingEngine::pause, vestingEngine::unpause))
                .roleHandler(new RoleHandler(vestingEngine, vestingEngine))
                .build()
                .setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> {
            ctx.response()
                    .setStatusCode(404)
                    .putHeader("Content-Type", "application/json")
                    .end(new JsonObject()
                            .put("status", "error")
                            .put("message", "Endpoint not found")
                            .encode()
                    );
        });

        int port = ledgerConfig.getHttpPort();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(server -> log.info("HTTP server listening on port {}", port))
                .mapEmpty();
    }
}
