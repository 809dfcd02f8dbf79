package com.caprouter.routing;

import com.caprouter.AppLogger;
import com.caprouter.capabilities.CapabilityRegistry;
import com.caprouter.guard.FieldSpec;
import com.caprouter.guard.JsonGuard;
import com.caprouter.guard.JsonGuardResult;
import com.caprouter.guard.ResponseSchema;
import com.caprouter.models.ChatMessage;
import com.caprouter.models.RouteDecision;

import java.util.List;
import java.util.Optional;

/**
 * Model-backed intent classifier. Asks the model for a {@link RouteDecision} in strict JSON,
 * offering only the intents of the fixed vocabulary and the capability ids currently in scope.
 */
public class SemanticClassifier {

    static final int HISTORY_TURNS = 4;
    static final int HISTORY_CHARS = 160;

    static final ResponseSchema<RouteDecision> ROUTE_DECISION_SCHEMA =
        new ResponseSchema<>("RouteDecision", RouteDecision.class)
            .field("intent", FieldSpec.Type.STRING, false)
            .field("entities", FieldSpec.Type.OBJECT, false)
            .field("candidate_tools", FieldSpec.Type.STRING_ARRAY, false)
            .number("confidence", false, 0.0, 1.0)
            .field("needs_clarification", FieldSpec.Type.BOOLEAN, false)
            .field("clarification_question", FieldSpec.Type.STRING, false)
            .alias("tools", "candidate_tools")
            .alias("candidates", "candidate_tools")
            .alias("candidatetools", "candidate_tools")
            .alias("needsclarification", "needs_clarification")
            .alias("clarification", "clarification_question")
            .allowUnknownFields(true);

    private static final String SYSTEM_PROMPT =
        "You are a semantic intent classifier for a personal assistant. "
            + "Return only JSON, with high precision.";

    private final CapabilityRegistry capabilityRegistry;
    private final JsonGuard jsonGuard;
    private final int maxRetries;

    public SemanticClassifier(CapabilityRegistry capabilityRegistry, JsonGuard jsonGuard, int maxRetries) {
        if (capabilityRegistry == null || jsonGuard == null) {
            throw new IllegalArgumentException("Capability registry and JSON guard are required");
        }
        this.capabilityRegistry = capabilityRegistry;
        this.jsonGuard = jsonGuard;
        this.maxRetries = Math.max(0, maxRetries);
    }

    /**
     * Empty when no capability is in scope or the model never produced a valid decision.
     */
    public Optional<RouteDecision> classify(String message, List<ChatMessage> history) {
        List<String> allowedTools = capabilityRegistry.allIds();
        if (allowedTools.isEmpty()) {
            return Optional.empty();
        }

        String userPrompt = buildUserPrompt(message, history, allowedTools);
        JsonGuardResult<RouteDecision> result =
            jsonGuard.generate(SYSTEM_PROMPT, userPrompt, ROUTE_DECISION_SCHEMA, maxRetries);

        if (!result.isPresent()) {
            String lastError = result.getTrace().getLastError();
            AppLogger logger = AppLogger.get();
            if (logger != null && lastError != null && !lastError.isBlank()) {
                logger.warn("Router JSON invalid after " + result.getTrace().getAttempts()
                    + " attempt(s), falling back to heuristic. Error: " + lastError);
            }
        }
        return result.getValue();
    }

    static String buildUserPrompt(String message, List<ChatMessage> history, List<String> allowedTools) {
        StringBuilder builder = new StringBuilder();
        builder.append("Classify the following message and propose candidate tools.\n");
        builder.append("Current message: ").append(message == null ? "" : message).append("\n");
        builder.append("Recent history:\n").append(formatHistory(history)).append("\n");
        builder.append("Allowed intents: ").append(String.join(", ", Intents.ALL)).append(".\n");
        builder.append("Allowed tools: ").append(String.join(", ", allowedTools)).append("\n");
        builder.append("Required schema:\n")
            .append("{\n")
            .append("  \"intent\": \"...\",\n")
            .append("  \"entities\": {\"query\": \"...\", \"temporal_reference\": true},\n")
            .append("  \"candidate_tools\": [\"tool_a\", \"tool_b\"],\n")
            .append("  \"confidence\": 0.0,\n")
            .append("  \"needs_clarification\": false,\n")
            .append("  \"clarification_question\": \"\"\n")
            .append("}");
        return builder.toString();
    }

    static String formatHistory(List<ChatMessage> history) {
        if (history == null || history.isEmpty()) {
            return "- (no history)";
        }
        List<ChatMessage> tail = history.subList(Math.max(0, history.size() - HISTORY_TURNS), history.size());
        StringBuilder builder = new StringBuilder();
        for (ChatMessage turn : tail) {
            if (turn == null) continue;
            String role = turn.getRole() != null ? turn.getRole() : "unknown";
            String content = turn.getContent() != null ? turn.getContent() : "";
            if (content.length() > HISTORY_CHARS) {
                content = content.substring(0, HISTORY_CHARS);
            }
            if (builder.length() > 0) builder.append("\n");
            builder.append("- ").append(role).append(": ").append(content);
        }
        return builder.length() > 0 ? builder.toString() : "- (no history)";
    }
}
