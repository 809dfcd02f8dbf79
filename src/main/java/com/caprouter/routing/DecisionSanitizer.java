package com.caprouter.routing;

import com.caprouter.capabilities.CapabilityIds;
import com.caprouter.capabilities.CapabilityRegistry;
import com.caprouter.capabilities.ProductScope;
import com.caprouter.models.RouteDecision;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Forces a decision (from either classifier) into compliance with the registry and the scope.
 * <p>
 * After sanitizing, every candidate tool resolves in the registry and is allowed by scope,
 * and the list is non-empty whenever chat_general is allowed.
 */
public class DecisionSanitizer {

    static final double MIN_CONFIDENCE = 0.05;
    static final double MAX_CONFIDENCE = 1.0;
    public static final String DEFAULT_CLARIFICATION_QUESTION =
        "¿Podrías darme un poco más de contexto para ayudarte mejor?";

    private final CapabilityRegistry capabilityRegistry;
    private final ProductScope productScope;

    public DecisionSanitizer(CapabilityRegistry capabilityRegistry, ProductScope productScope) {
        if (capabilityRegistry == null || productScope == null) {
            throw new IllegalArgumentException("Capability registry and product scope are required");
        }
        this.capabilityRegistry = capabilityRegistry;
        this.productScope = productScope;
    }

    /**
     * Returns a sanitized copy; the input decision is not modified.
     */
    public RouteDecision sanitize(String message, RouteDecision input) {
        RouteDecision decision = input != null ? input.copy() : new RouteDecision();
        decision.setIntent(Intents.canonicalize(decision.getIntent()));

        Set<String> allowedTools = new LinkedHashSet<>(capabilityRegistry.allIds());
        List<String> filtered = new ArrayList<>();
        for (String toolId : decision.getCandidateTools()) {
            if (toolId != null && allowedTools.contains(toolId.trim())) {
                filtered.add(toolId.trim());
            }
        }
        if (filtered.isEmpty() && allowedTools.contains(CapabilityIds.CHAT_GENERAL)) {
            filtered.add(CapabilityIds.CHAT_GENERAL);
        }

        if (Intents.WEB_SEARCH.equals(decision.getIntent()) && decision.getQuery().isEmpty()) {
            String query = SearchQueryExtractor.extract(message);
            decision.getEntities().put(RouteDecision.ENTITY_QUERY,
                query != null ? query : SearchQueryExtractor.normalize(message));
        }

        boolean temporal = decision.hasTemporalReference() || TemporalReferences.hasTemporalReference(message);
        if (temporal) {
            decision.getEntities().put(RouteDecision.ENTITY_TEMPORAL_REFERENCE, true);
            String datetime = CapabilityIds.GET_CURRENT_DATETIME;
            if (allowedTools.contains(datetime) && (filtered.isEmpty() || !datetime.equals(filtered.get(0)))) {
                filtered.remove(datetime);
                filtered.add(0, datetime);
            }
        } else if (!decision.getEntities().containsKey(RouteDecision.ENTITY_TEMPORAL_REFERENCE)) {
            decision.getEntities().put(RouteDecision.ENTITY_TEMPORAL_REFERENCE, false);
        }

        // A primary already proposed keeps its position, even behind the datetime tool.
        String primary = Intents.primaryTool(decision.getIntent());
        if (primary != null && allowedTools.contains(primary) && !containsPrimary(decision.getIntent(), filtered)) {
            filtered.add(0, primary);
        }

        List<String> candidates = productScope.filterAllowed(filtered);
        if (candidates.isEmpty() && productScope.isAllowed(CapabilityIds.CHAT_GENERAL)
            && capabilityRegistry.has(CapabilityIds.CHAT_GENERAL)) {
            candidates.add(CapabilityIds.CHAT_GENERAL);
        }
        decision.setCandidateTools(candidates);

        String question = decision.getClarificationQuestion();
        if (decision.isNeedsClarification() && (question == null || question.isBlank())) {
            decision.setClarificationQuestion(DEFAULT_CLARIFICATION_QUESTION);
        } else if (question == null) {
            decision.setClarificationQuestion("");
        }

        decision.setConfidence(clampConfidence(decision.getConfidence()));
        return decision;
    }

    /**
     * For web searches the news search counts as a search tool too.
     */
    private boolean containsPrimary(String intent, List<String> tools) {
        if (Intents.WEB_SEARCH.equals(intent)) {
            return tools.contains(CapabilityIds.WEB_SEARCH_GENERAL) || tools.contains(CapabilityIds.WEB_SEARCH_NEWS);
        }
        return tools.contains(Intents.primaryTool(intent));
    }

    static double clampConfidence(double confidence) {
        if (Double.isNaN(confidence) || confidence < MIN_CONFIDENCE) {
            return MIN_CONFIDENCE;
        }
        return Math.min(confidence, MAX_CONFIDENCE);
    }
}
