package com.vestlock.adapter.in.web;

import com.vestlock.adapter.in.web.custody.CustodyAccountHandler;
import com.vestlock.adapter.in.web.deposit.DepositHandler;
import com.vestlock.adapter.in.web.lockquery.LockQueryHandler;
import com.vestlock.adapter.in.web.solvency.SolvencyHandler;
import com.vestlock.adapter.in.web.withdraw.WithdrawHandler;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import lombok.RequiredArgsConstructor;

/**
 * Router configuration for lock endpoints
 */
@RequiredArgsConstructor
public class WebRouter {

    private final Router router;
    private final DepositHandler depositHandler;
    private final WithdrawHandler withdrawHandler;
    private final LockQueryHandler lockQueryHandler;
    private final SolvencyHandler solvencyHandler;
    private final CustodyAccountHandler custodyAccountHandler;

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Requested-With");
            ctx.next();
        });

        router.options("/api/*").handler(ctx -> ctx.response().setStatusCode(204).end());

        // Lifecycle
        router.post("/api/locks")
                .handler(BodyHandler.create())
                .handler(depositHandler);
        router.post("/api/locks/:id/withdraw")
                .handler(BodyHandler.create())
                .handler(withdrawHandler);

        // Valuation and maturity
        router.get("/api/locks/:id").handler(lockQueryHandler::getLock);
        router.get("/api/locks/:id/asset").handler(lockQueryHandler::getAsset);
        router.get("/api/locks/:id/balance").handler(lockQueryHandler::getBalance);
        router.get("/api/locks/:id/maturity").handler(lockQueryHandler::getMaturity);
        router.get("/api/owners/:owner/locks").handler(lockQueryHandler::findByOwner);

        // Solvency
        router.get("/api/solvency").handler(solvencyHandler::auditAll);
        router.get("/api/solvency/:asset").handler(solvencyHandler::audit);

        // Simulated asset ledger
        if (custodyAccountHandler != null) {
            router.post("/api/accounts/:account/credit")
                    .handler(BodyHandler.create())
                    .handler(custodyAccountHandler::credit);
            router.get("/api/accounts/:account/balance").handler(custodyAccountHandler::balance);
        }

        // Health check endpoint
        router.get("/health")
                .handler(ctx -> ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end("{\"status\":\"UP\",\"service\":\"time-lock-ledger\"}"));

        // Root endpoint
        router.get("/")
                .handler(ctx -> ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end("{\"name\":\"Time Lock Ledger\",\"version\":\"1.0.0\"}"));
    }
}
