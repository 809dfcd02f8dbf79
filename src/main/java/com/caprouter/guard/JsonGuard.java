package com.caprouter.guard;

import com.caprouter.AppLogger;
import com.caprouter.llm.ModelClient;
import com.caprouter.models.ChatMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.List;

/**
 * Generation, validation and repair loop that turns free-form model text into a
 * schema-valid value.
 * <p>
 * Each reply is tried as-is and then locally repaired; the first candidate that parses and
 * validates wins. Otherwise the model is asked again, shown its previous reply and the exact
 * validation error, until {@code maxRetries + 1} attempts are spent. Running out of attempts
 * yields an empty result, never an exception.
 */
public class JsonGuard {

    public static final int DEFAULT_MAX_RETRIES = 2;

    static final String JSON_ONLY_INSTRUCTION =
        "You must answer ONLY with a valid JSON object. Do not use markdown and do not add any extra text.";
    static final String NO_OBJECT_ERROR = "no-json-object: no JSON object found in the output";

    private final ModelClient modelClient;
    private final ObjectMapper objectMapper;

    public JsonGuard(ModelClient modelClient, ObjectMapper objectMapper) {
        if (modelClient == null) {
            throw new IllegalArgumentException("Model client is required");
        }
        this.modelClient = modelClient;
        ObjectMapper mapper = objectMapper != null ? objectMapper.copy() : new ObjectMapper();
        mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.objectMapper = mapper;
    }

    public <T> JsonGuardResult<T> generate(String systemPrompt, String userPrompt, ResponseSchema<T> schema) {
        return generate(systemPrompt, userPrompt, schema, DEFAULT_MAX_RETRIES);
    }

    public <T> JsonGuardResult<T> generate(String systemPrompt, String userPrompt, ResponseSchema<T> schema,
                                           int maxRetries) {
        if (schema == null) {
            throw new IllegalArgumentException("Response schema is required");
        }
        JsonGuardTrace trace = new JsonGuardTrace();
        String guardedSystemPrompt = (systemPrompt == null ? "" : systemPrompt.trim()) + "\n\n" + JSON_ONLY_INSTRUCTION;
        String prompt = userPrompt != null ? userPrompt : "";

        List<ChatMessage> messages = List.of(ChatMessage.user(prompt));
        int attempts = Math.max(0, maxRetries) + 1;

        for (int attempt = 0; attempt < attempts; attempt++) {
            String raw;
            try {
                raw = modelClient.generate(messages, guardedSystemPrompt);
            } catch (IOException e) {
                trace.setLastError("model-call-failed: " + e.getMessage());
                warn("Model call failed during " + schema.getName() + " generation: " + e.getMessage());
                return JsonGuardResult.empty(trace);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                trace.setLastError("model-call-interrupted");
                return JsonGuardResult.empty(trace);
            }
            if (raw == null) {
                raw = "";
            }
            trace.addOutput(raw);

            for (String candidate : List.of(raw, JsonRepair.repair(raw))) {
                T parsed = tryParse(candidate, schema, trace);
                if (parsed != null) {
                    return JsonGuardResult.of(parsed, trace);
                }
            }

            AppLogger logger = AppLogger.get();
            if (logger != null && logger.isDebugEnabled()) {
                logger.debug(schema.getName() + " attempt " + (attempt + 1) + "/" + attempts
                    + " rejected: " + trace.getLastError());
            }
            if (attempt >= attempts - 1) {
                break;
            }
            messages = List.of(
                ChatMessage.user(prompt),
                ChatMessage.assistant(raw),
                ChatMessage.user(buildRepairRequest(trace.getLastError()))
            );
        }
        return JsonGuardResult.empty(trace);
    }

    static String buildRepairRequest(String validationError) {
        return "Your output does not match the required JSON schema. "
            + "Validation error: " + validationError + "\n"
            + "Return only valid JSON, without markdown and without extra text.";
    }

    private <T> T tryParse(String candidate, ResponseSchema<T> schema, JsonGuardTrace trace) {
        String json = JsonRepair.extractFirstObject(candidate);
        if (json.isEmpty()) {
            trace.setLastError(NO_OBJECT_ERROR);
            return null;
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            trace.setLastError("invalid-json: " + e.getOriginalMessage());
            return null;
        }
        JsonNode normalized = schema.normalize(node);
        String error = schema.validate(normalized);
        if (error != null) {
            trace.setLastError(error);
            return null;
        }
        try {
            return schema.convert(normalized, objectMapper);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            trace.setLastError("invalid-shape: " + e.getMessage());
            return null;
        }
    }

    private void warn(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn(message);
        }
    }
}
