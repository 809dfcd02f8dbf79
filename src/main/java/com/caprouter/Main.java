package com.caprouter;

import com.caprouter.capabilities.CapabilityRegistry;
import com.caprouter.capabilities.ProductScope;
import com.caprouter.capabilities.ScopeConsistency;
import com.caprouter.controllers.Controller;
import com.caprouter.controllers.RouterController;
import com.caprouter.guard.JsonGuard;
import com.caprouter.llm.ModelClient;
import com.caprouter.llm.ModelClientFactory;
import com.caprouter.routing.SemanticRouter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.util.List;
import java.util.Map;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .fromEnvironment(System.getenv())
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            ProductScope productScope = new ProductScope(config.getScopePath());
            CapabilityRegistry capabilityRegistry = new CapabilityRegistry(config.getCapabilitiesPath(), productScope);
            logScopeAudit(capabilityRegistry);

            ModelClient modelClient = new ModelClientFactory(objectMapper).create(config.getModelEndpoint());
            JsonGuard jsonGuard = new JsonGuard(modelClient, objectMapper);
            SemanticRouter router = new SemanticRouter(capabilityRegistry, productScope, jsonGuard,
                    config.getMaxRetries());
            logger.info("Router ready: model=" + config.getModelEndpoint().getModel()
                    + " provider=" + config.getModelEndpoint().getProvider()
                    + " maxRetries=" + config.getMaxRetries());

            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper));
                cfg.http.defaultContentType = "application/json";
            });

            List<Controller> controllers = List.of(
                    new RouterController(router, capabilityRegistry, productScope, objectMapper)
            );
            for (Controller controller : controllers) {
                controller.registerRoutes(app);
            }
            app.get("/api/health", ctx -> ctx.json(Map.of("status", "ok", "version", VERSION)));

            registerExceptionHandlers(app);

            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start Capability Router: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Capability Router v" + VERSION);
        logger.console("========================================");
        logger.console("  Capabilities: " + config.getCapabilitiesPath());
        logger.console("  Scope: " + config.getScopePath());
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
        logger.console("");
    }

    private static void logScopeAudit(CapabilityRegistry capabilityRegistry) {
        ScopeConsistency consistency = capabilityRegistry.ensureScopeConsistency();
        if (consistency.isConsistent()) {
            logger.info("Scope audit: registry and scope are consistent");
            return;
        }
        if (!consistency.getMissingInRegistry().isEmpty()) {
            logger.warn("Scope audit: in scope but not in registry: " + consistency.getMissingInRegistry());
        }
        if (!consistency.getMissingInScope().isEmpty()) {
            logger.info("Scope audit: in registry but out of scope: " + consistency.getMissingInScope());
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            logger.warn("Bad request: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
