package com.caprouter.controllers;

import com.caprouter.AppLogger;
import com.caprouter.capabilities.CapabilityRegistry;
import com.caprouter.capabilities.ProductScope;
import com.caprouter.capabilities.ScopeConsistency;
import com.caprouter.models.CapabilityDefinition;
import com.caprouter.models.RouteDecision;
import com.caprouter.models.RouteRequest;
import com.caprouter.routing.SemanticRouter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnostic surface over the router: classify a message, inspect the catalog, reload documents.
 * Nothing here executes a capability.
 */
public class RouterController implements Controller {
    private final SemanticRouter router;
    private final CapabilityRegistry capabilityRegistry;
    private final ProductScope productScope;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public RouterController(SemanticRouter router, CapabilityRegistry capabilityRegistry,
                            ProductScope productScope, ObjectMapper objectMapper) {
        this.router = router;
        this.capabilityRegistry = capabilityRegistry;
        this.productScope = productScope;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/route", this::route);
        app.get("/api/capabilities", this::listCapabilities);
        app.post("/api/capabilities/reload", this::reload);
        app.get("/api/capabilities/{id}", this::getCapability);
        app.get("/api/capabilities/{id}/chain", this::getChain);
        app.get("/api/scope/audit", this::auditScope);
    }

    private void route(Context ctx) {
        RouteRequest request;
        try {
            request = objectMapper.readValue(ctx.body(), RouteRequest.class);
        } catch (Exception e) {
            ctx.status(400).json(Controller.errorBody(e));
            return;
        }
        if (request == null || request.getMessage() == null || request.getMessage().isBlank()) {
            ctx.status(400).json(Map.of("error", "message is required"));
            return;
        }
        RouteDecision decision = router.route(request.getMessage(), request.getHistory());
        ctx.json(decision);
    }

    private void listCapabilities(Context ctx) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("version", capabilityRegistry.getVersion());
        body.put("updatedAt", capabilityRegistry.getUpdatedAt());
        body.put("ids", capabilityRegistry.allIds());
        ctx.json(body);
    }

    private void getCapability(Context ctx) {
        String id = ctx.pathParam("id");
        CapabilityDefinition capability = capabilityRegistry.get(id);
        if (capability == null) {
            ctx.status(404).json(Map.of("error", "Capability not found: " + id));
            return;
        }
        ctx.json(capability);
    }

    private void getChain(Context ctx) {
        String id = ctx.pathParam("id");
        List<String> chain = capabilityRegistry.resolveChain(id);
        if (chain.isEmpty()) {
            ctx.status(404).json(Map.of("error", "Capability not found: " + id));
            return;
        }
        ctx.json(Map.of("primary", id, "chain", chain));
    }

    private void reload(Context ctx) {
        productScope.reload();
        capabilityRegistry.reload();
        if (logger != null) {
            logger.info("Reloaded scope (" + productScope.getCapabilities().size() + ") and registry ("
                + capabilityRegistry.size() + ")");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("scopeCapabilities", productScope.getCapabilities().size());
        body.put("registryCapabilities", capabilityRegistry.size());
        body.put("version", capabilityRegistry.getVersion());
        ctx.json(body);
    }

    private void auditScope(Context ctx) {
        ScopeConsistency consistency = capabilityRegistry.ensureScopeConsistency();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("missingInRegistry", consistency.getMissingInRegistry());
        body.put("missingInScope", consistency.getMissingInScope());
        body.put("consistent", consistency.isConsistent());
        ctx.json(body);
    }
}
