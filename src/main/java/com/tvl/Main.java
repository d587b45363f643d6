package com.tvl;

import com.tvl.adapter.in.event.LedgerAuditVerticle;
import com.tvl.adapter.in.web.HttpServerVerticle;
import com.tvl.adapter.out.event.LedgerEventCodec;
import com.tvl.domain.event.LedgerEvent;
import com.tvl.infrastructure.config.ConfigLoader;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Starting Token Vesting Ledger...");

        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(10)
                .setEventLoopPoolSize(5);

        Vertx vertx = Vertx.vertx(options);

        // Register message codec for LedgerEvent
        vertx.eventBus().registerDefaultCodec(LedgerEvent.class, new LedgerEventCodec());
        log.info("Registered LedgerEvent message codec");

        JsonObject config = ConfigLoader.load();

        // The audit consumer must be listening before the first ledger event is published
        vertx.deployVerticle(new LedgerAuditVerticle())
                .compose(auditId -> {
                    log.info("Ledger Audit Verticle deployed successfully: {}", auditId);
                    return vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions()
                            .setConfig(config)
                            .setInstances(1));
                })
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down Token Vesting Ledger...");
                        vertx.close();
                    }));

                    int port = config.getJsonObject("http", new JsonObject()).getInteger("port", 8080);
                    log.info("Token Vesting Ledger is ready!");
                    log.info("API Endpoint: http://localhost:{}/api/schedules", port);
                    log.info("Health Check: http://localhost:{}/health", port);
                })
                .onFailure(error -> {
                    log.error("Failed to deploy verticles", error);
                    vertx.close();
                });
    }
}
