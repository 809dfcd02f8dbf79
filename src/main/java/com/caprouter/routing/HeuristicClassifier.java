package com.caprouter.routing;

import com.caprouter.capabilities.CapabilityIds;
import com.caprouter.models.RouteDecision;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Deterministic keyword classifier. Always available, used as the baseline the model-based
 * classifier has to beat.
 * <p>
 * Detectors run in a fixed priority order and the first match wins: reminders, memory purge,
 * update, delete, recall, store, then web search, bare temporal questions, and finally a
 * low-confidence general_chat.
 */
public final class HeuristicClassifier {

    static final double WEB_SEARCH_CONFIDENCE = 0.78;
    static final double TIME_SENSITIVE_CONFIDENCE = 0.70;
    static final double GENERAL_CHAT_CONFIDENCE = 0.55;

    private static final Pattern WEB_HINT = RoutingPatterns.compile(
        "\\b(busca|buscar|investiga|consulta|averigua|google|internet|web|"
            + "noticias?|precio|cotizacion|cotización|valor|actual)\\b");
    private static final Pattern NEWS_HINT = RoutingPatterns.compile("\\b(noticias?|news|titulares|actualidad)\\b");

    private static final List<Rule> RULES = List.of(
        new Rule(Intents.REMINDER_MANAGEMENT, 0.80,
            "\\b(recordatorio|recordatorios|recuerdame|recuérdame|avisame|avísame|"
                + "elimina\\s+recordatorio|lista\\s+recordatorios|pendientes)\\b",
            CapabilityIds.REMINDER_CREATE, CapabilityIds.REMINDER_LIST, CapabilityIds.REMINDER_DELETE),
        new Rule(Intents.MEMORY_PURGE, 0.76,
            "\\b(protocolo\\s+de\\s+borrado|borrado\\s+de\\s+memoria|"
                + "resetea(?:r)?\\s+memoria|reinicia(?:r)?\\s+memoria)\\b|"
                + "\\b(borra|elimina|limpia|olvida)\\b.{0,35}\\b(toda|todo)\\b.{0,35}\\b(memoria|conversaciones?)\\b",
            CapabilityIds.MEMORY_PURGE_ALL, CapabilityIds.CHAT_GENERAL),
        new Rule(Intents.MEMORY_UPDATE, 0.72,
            "\\b(actualiza|corrige|edita|modifica|cambia)\\b.{0,45}\\b("
                + "memoria|recuerdo|dato|lo\\s+que\\s+recuerdas|perfil)\\b",
            CapabilityIds.MEMORY_UPDATE_USER_FACT, CapabilityIds.MEMORY_RECALL_PROFILE),
        new Rule(Intents.MEMORY_DELETE, 0.72,
            "\\b(olvida|borra|elimina|quita|remueve)\\b.{0,45}\\b("
                + "memoria|recuerdo|dato|lo\\s+que\\s+recuerdas|perfil)\\b",
            CapabilityIds.MEMORY_DELETE_USER_FACT, CapabilityIds.MEMORY_RECALL_PROFILE),
        new Rule(Intents.MEMORY_RECALL, 0.73,
            "\\b(que\\s+recuerdas|qué\\s+recuerdas|que\\s+sabes\\s+de\\s+mi|mi\\s+perfil|"
                + "lo\\s+que\\s+tienes\\s+guardado|recuerdos?\\s+sobre)\\b",
            CapabilityIds.MEMORY_RECALL_PROFILE, CapabilityIds.MEMORY_RETRIEVAL),
        new Rule(Intents.MEMORY_STORE, 0.73,
            "\\b(recuerda\\s+que|acu[eé]rdate\\s+de|guarda(?:r)?\\s+en\\s+(?:tu\\s+)?memoria|"
                + "ten\\s+presente\\s+que|anota(?:r)?\\s+en\\s+tu\\s+memoria)\\b",
            CapabilityIds.MEMORY_STORE_USER_FACT, CapabilityIds.MEMORY_STORE_SUMMARY)
    );

    private HeuristicClassifier() {
    }

    public static RouteDecision classify(String message) {
        String clean = message == null ? "" : message.trim();
        boolean temporal = TemporalReferences.hasTemporalReference(clean);

        for (Rule rule : RULES) {
            if (rule.pattern.matcher(clean).find()) {
                return new RouteDecision(rule.intent, temporalOnly(temporal), rule.tools, rule.confidence);
            }
        }

        String extracted = SearchQueryExtractor.extract(clean);
        if (extracted != null || WEB_HINT.matcher(clean).find()) {
            String query = extracted != null ? extracted : SearchQueryExtractor.normalize(clean);
            boolean preferNews = NEWS_HINT.matcher(clean).find();
            String primary = preferNews ? CapabilityIds.WEB_SEARCH_NEWS : CapabilityIds.WEB_SEARCH_GENERAL;

            Map<String, Object> entities = new LinkedHashMap<>();
            entities.put(RouteDecision.ENTITY_QUERY, query);
            entities.put(RouteDecision.ENTITY_TEMPORAL_REFERENCE, temporal);
            entities.put(RouteDecision.ENTITY_PREFER_NEWS, preferNews);
            return new RouteDecision(Intents.WEB_SEARCH, entities,
                List.of(primary, CapabilityIds.WEB_SEARCH_GENERAL, CapabilityIds.CHAT_GENERAL),
                WEB_SEARCH_CONFIDENCE);
        }

        if (temporal) {
            return new RouteDecision(Intents.TIME_SENSITIVE_ANSWER, temporalOnly(true),
                List.of(CapabilityIds.GET_CURRENT_DATETIME, CapabilityIds.CHAT_GENERAL),
                TIME_SENSITIVE_CONFIDENCE);
        }

        return new RouteDecision(Intents.GENERAL_CHAT, temporalOnly(false),
            List.of(CapabilityIds.CHAT_GENERAL), GENERAL_CHAT_CONFIDENCE);
    }

    private static Map<String, Object> temporalOnly(boolean temporal) {
        Map<String, Object> entities = new LinkedHashMap<>();
        entities.put(RouteDecision.ENTITY_TEMPORAL_REFERENCE, temporal);
        return entities;
    }

    private static final class Rule {
        private final String intent;
        private final double confidence;
        private final Pattern pattern;
        private final List<String> tools;

        private Rule(String intent, double confidence, String regex, String... tools) {
            this.intent = intent;
            this.confidence = confidence;
            this.pattern = RoutingPatterns.compile(regex);
            this.tools = List.of(tools);
        }
    }
}
