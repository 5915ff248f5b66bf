package com.vestlock.adapter.in.web.solvency;

import com.vestlock.adapter.in.web.ApiErrorResponse;
import com.vestlock.application.port.in.SolvencyAuditUseCase;
import com.vestlock.application.port.in.SolvencyAuditUseCase.SolvencyReport;
import com.vestlock.domain.model.AssetRef;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * HTTP handlers for solvency reports
 */
@RequiredArgsConstructor
public class SolvencyHandler {

    private final SolvencyAuditUseCase solvencyAuditUseCase;

    // GET /api/solvency/:asset
    public void audit(RoutingContext context) {
        AssetRef asset;
        try {
            asset = AssetRef.parse(context.pathParam("asset"));
        } catch (IllegalArgumentException e) {
            ApiErrorResponse.send(context, 400, e.getMessage());
            return;
        }

        solvencyAuditUseCase.audit(asset)
                .onSuccess(report -> send(context, toJson(report)))
                .onFailure(error -> ApiErrorResponse.send(context, error));
    }

    // GET /api/solvency
    public void auditAll(RoutingContext context) {
        solvencyAuditUseCase.auditAll()
                .onSuccess(reports -> {
                    JsonArray items = new JsonArray();
                    reports.forEach(report -> items.add(toJson(report)));
                    boolean solvent = reports.stream().allMatch(SolvencyReport::isSolvent);
                    send(context, new JsonObject().put("solvent", solvent).put("assets", items));
                })
                .onFailure(error -> ApiErrorResponse.send(context, error));
    }

    private static JsonObject toJson(SolvencyReport report) {
        return new JsonObject()
                .put("asset", report.asset().key())
                .put("totalLocked", report.totalLocked().toString())
                .put("custodyBalance", report.custodyBalance().toString())
                .put("solvent", report.isSolvent());
    }

    private static void send(RoutingContext context, JsonObject body) {
        context.response()
                .setStatusCode(200)
                .putHeader("Content-Type", "application/json")
                .end(body.encode());
    }
}
