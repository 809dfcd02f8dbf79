package com.caprouter.routing;

import com.caprouter.AppLogger;
import com.caprouter.capabilities.CapabilityRegistry;
import com.caprouter.capabilities.ProductScope;
import com.caprouter.guard.JsonGuard;
import com.caprouter.models.ChatMessage;
import com.caprouter.models.RouteDecision;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Entry point that turns a user message into a sanitized {@link RouteDecision}.
 * <p>
 * The heuristic decision is always computed; the model-based decision replaces it only when
 * its confidence reaches {@code max(0.35, heuristic - 0.10)}. The winner is then sanitized
 * against registry and scope. Routing never invokes the capabilities it selects and keeps no
 * state between calls.
 */
public class SemanticRouter {

    static final double MIN_SEMANTIC_CONFIDENCE = 0.35;
    static final double SEMANTIC_MARGIN = 0.10;
    // Absorbs binary rounding in (heuristic - margin), e.g. 0.80 - 0.10.
    private static final double EPSILON = 1e-9;

    private final SemanticClassifier semanticClassifier;
    private final DecisionSanitizer sanitizer;
    private final AppLogger logger;

    public SemanticRouter(CapabilityRegistry capabilityRegistry, ProductScope productScope, JsonGuard jsonGuard) {
        this(capabilityRegistry, productScope, jsonGuard, JsonGuard.DEFAULT_MAX_RETRIES);
    }

    public SemanticRouter(CapabilityRegistry capabilityRegistry, ProductScope productScope, JsonGuard jsonGuard,
                          int maxRetries) {
        this.semanticClassifier = new SemanticClassifier(capabilityRegistry, jsonGuard, maxRetries);
        this.sanitizer = new DecisionSanitizer(capabilityRegistry, productScope);
        this.logger = AppLogger.get();
    }

    public RouteDecision route(String message, List<ChatMessage> history) {
        RouteDecision heuristic = HeuristicClassifier.classify(message);
        Optional<RouteDecision> semantic = semanticClassifier.classify(message, history);

        RouteDecision decision = sanitizer.sanitize(message, fuse(heuristic, semantic));
        if (logger != null) {
            logger.info(String.format(Locale.ROOT, "Router decision: intent=%s confidence=%.2f tools=%s",
                decision.getIntent(), decision.getConfidence(), decision.getCandidateTools()));
        }
        return decision;
    }

    /**
     * Picks the model-based decision when it is confident enough and not meaningfully worse
     * than the heuristic one; otherwise keeps the heuristic decision.
     */
    static RouteDecision fuse(RouteDecision heuristic, Optional<RouteDecision> semantic) {
        if (semantic.isEmpty()) {
            return heuristic;
        }
        double threshold = Math.max(MIN_SEMANTIC_CONFIDENCE, heuristic.getConfidence() - SEMANTIC_MARGIN);
        return semantic.get().getConfidence() + EPSILON >= threshold ? semantic.get() : heuristic;
    }
}
