package com.tvl.adapter.in.web;

import com.tvl.adapter.in.web.admin.PauseHandler;
import com.tvl.adapter.in.web.admin.RoleHandler;
import com.tvl.adapter.in.web.allocation.AirdropHandler;
import com.tvl.adapter.in.web.allocation.AllocationHandler;
import com.tvl.adapter.in.web.allocation.ManagerHandler;
import com.tvl.adapter.in.web.vesting.VestingQueryHandler;
import com.tvl.adapter.in.web.vesting.VestingScheduleHandler;
import io.vertx.ext.web.Router;
import lombok.Builder;

/**
 * Router configuration for the allocation and vesting endpoints
 */
@Builder
public class WebRouter {

    private final Router router;
    private final AllocationHandler allocationHandler;
    private final AirdropHandler airdropHandler;
    private final ManagerHandler managerHandler;
    private final VestingScheduleHandler vestingScheduleHandler;
    private final VestingQueryHandler vestingQueryHandler;
    private final PauseHandler allocationPauseHandler;
    private final PauseHandler vestingPauseHandler;
    private final RoleHandler roleHandler;

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, DELETE, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Caller-Address")
                    .putHeader("Access-Control-Allow-Credentials", "true");
            ctx.next();
        });

        // Handle OPTIONS preflight requests
        router.options("/api/*").handler(ctx -> ctx.response().setStatusCode(204).end());

        // Allocation ledger
        router.post("/api/allocations").handler(allocationHandler::create);
        router.post("/api/allocations/pause").handler(allocationPauseHandler::pause);
        router.post("/api/allocations/unpause").handler(allocationPauseHandler::unpause);
        router.get("/api/allocations/:id").handler(allocationHandler::get);
        router.post("/api/allocations/:id/revoke").handler(allocationHandler::revoke);
        router.post("/api/allocations/:id/reduce").handler(allocationHandler::reduce);
        router.get("/api/beneficiaries/:address/allocations").handler(allocationHandler::listForBeneficiary);
        router.post("/api/airdrops").handler(airdropHandler);

        router.get("/api/managers").handler(managerHandler::list);
        router.post("/api/managers").handler(managerHandler::add);
        router.delete("/api/managers/:address").handler(managerHandler::remove);

        // Vesting engine
        router.post("/api/schedules").handler(vestingScheduleHandler::create);
        router.post("/api/schedules/batch-force-revoke").handler(vestingScheduleHandler::batchForceRevoke);
        router.get("/api/schedules/:id").handler(vestingQueryHandler::get);
        router.get("/api/schedules/:id/info").handler(vestingQueryHandler::info);
        router.post("/api/schedules/:id/claim").handler(vestingScheduleHandler::claim);
        router.post("/api/schedules/:id/unlock").handler(vestingScheduleHandler::unlock);
        router.post("/api/schedules/:id/revoke").handler(vestingScheduleHandler::revoke);
        router.post("/api/schedules/:id/force-revoke").handler(vestingScheduleHandler::forceRevoke);
        router.get("/api/beneficiaries/:address/schedules").handler(vestingQueryHandler::listForBeneficiary);
        router.get("/api/vesting/totals").handler(vestingQueryHandler::totals);
        router.post("/api/vesting/pause").handler(vestingPauseHandler::pause);
        router.post("/api/vesting/unpause").handler(vestingPauseHandler::unpause);

        router.post("/api/vesting/roles").handler(roleHandler::grant);
        router.get("/api/vesting/roles/:role/:account").handler(roleHandler::check);
        router.delete("/api/vesting/roles/:role/:account").handler(roleHandler::revoke);

        // Health check endpoint
        router.get("/health")
                .handler(ctx -> {
                    ctx.response()
                            .putHeader("Content-Type", "application/json")
                            .end("{\"status\":\"UP\",\"service\":\"token-vesting-ledger\"}");
                });

        // Root endpoint
        router.get("/")
                .handler(ctx -> {
                    ctx.response()
                            .putHeader("Content-Type", "application/json")
                            .end("{\"name\":\"Token Vesting Ledger\",\"version\":\"1.0.0\"}");
                });
    }
}
