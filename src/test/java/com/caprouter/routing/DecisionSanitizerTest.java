package com.caprouter.routing;

import com.caprouter.TestDocuments;
import com.caprouter.capabilities.CapabilityRegistry;
import com.caprouter.capabilities.ProductScope;
import com.caprouter.models.RouteDecision;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DecisionSanitizerTest {

    @TempDir
    Path tempDir;

    private DecisionSanitizer sanitizer(List<String> scopeIds) throws Exception {
        ProductScope scope = scopeIds == null
            ? new ProductScope(TestDocuments.bundledScope(tempDir))
            : ProductScope.of(scopeIds);
        CapabilityRegistry registry = new CapabilityRegistry(TestDocuments.bundledCapabilities(tempDir), scope);
        return new DecisionSanitizer(registry, scope);
    }

    private static RouteDecision decision(String intent, double confidence, String... tools) {
        return new RouteDecision(intent, Map.of(), List.of(tools), confidence);
    }

    @Test
    void canonicalizesIntentSynonyms() throws Exception {
        RouteDecision result = sanitizer(null).sanitize("bórralo todo", decision("memory_wipe", 0.9, "memory_purge_all"));
        assertEquals(Intents.MEMORY_PURGE, result.getIntent());
        assertEquals(List.of("memory_purge_all"), result.getCandidateTools());
    }

    @Test
    void unknownIntentBecomesGeneralChat() throws Exception {
        RouteDecision result = sanitizer(null).sanitize("canta algo", decision("sing_a_song", 0.6, "chat_general"));
        assertEquals(Intents.GENERAL_CHAT, result.getIntent());
    }

    @Test
    void outOfScopeToolsFallBackToChat() throws Exception {
        RouteDecision result = sanitizer(null).sanitize("hola",
            decision(Intents.GENERAL_CHAT, 0.6, "payments_charge", "shopping_cart"));
        assertEquals(List.of("chat_general"), result.getCandidateTools());
    }

    @Test
    void noFallbackWhenChatIsOutOfScope() throws Exception {
        RouteDecision result = sanitizer(List.of("reminder_list")).sanitize("hola",
            decision(Intents.GENERAL_CHAT, 0.6, "chat_general", "payments_charge"));
        assertTrue(result.getCandidateTools().isEmpty());
    }

    @Test
    void dropsNullAndDuplicateTools() throws Exception {
        RouteDecision input = decision(Intents.GENERAL_CHAT, 0.6);
        input.setCandidateTools(new ArrayList<>(Arrays.asList("chat_general", null, " chat_general ")));
        assertEquals(List.of("chat_general"), sanitizer(null).sanitize("hola", input).getCandidateTools());
    }

    @Test
    void missingPrimaryToolIsInsertedFirst() throws Exception {
        RouteDecision result = sanitizer(null).sanitize("recuerda esto",
            decision(Intents.MEMORY_STORE, 0.8, "chat_general"));
        assertEquals(List.of("memory_store_user_fact", "chat_general"), result.getCandidateTools());
    }

    @Test
    void proposedPrimaryToolKeepsItsPosition() throws Exception {
        RouteDecision result = sanitizer(null).sanitize("recuerda esto",
            decision(Intents.MEMORY_STORE, 0.8, "chat_general", "memory_store_user_fact"));
        assertEquals(List.of("chat_general", "memory_store_user_fact"), result.getCandidateTools());
    }

    @Test
    void insertedPrimaryToolGoesAheadOfDatetime() throws Exception {
        RouteDecision memory = sanitizer(null).sanitize("recuerda que mañana tengo cita",
            decision(Intents.MEMORY_STORE, 0.8, "chat_general"));
        assertEquals(List.of("memory_store_user_fact", "get_current_datetime", "chat_general"),
            memory.getCandidateTools());
        assertTrue(memory.hasTemporalReference());

        RouteDecision search = sanitizer(null).sanitize("que paso hoy",
            decision(Intents.WEB_SEARCH, 0.8, "chat_general"));
        assertEquals(List.of("web_search_general", "get_current_datetime", "chat_general"),
            search.getCandidateTools());
    }

    @Test
    void webSearchGetsPrimaryToolAndQuery() throws Exception {
        RouteDecision result = sanitizer(null).sanitize("Busca vuelos a Lima",
            decision(Intents.WEB_SEARCH, 0.8, "chat_general"));
        assertEquals(List.of("web_search_general", "chat_general"), result.getCandidateTools());
        assertEquals("vuelos a lima", result.getQuery());
        assertFalse(result.hasTemporalReference());
    }

    @Test
    void newsSearchMayLeadWebSearch() throws Exception {
        RouteDecision result = sanitizer(null).sanitize("noticias de hoy",
            decision(Intents.WEB_SEARCH, 0.8, "web_search_news", "chat_general"));
        assertEquals(List.of("get_current_datetime", "web_search_news", "chat_general"), result.getCandidateTools());
    }

    @Test
    void temporalReferencePrependsDatetime() throws Exception {
        RouteDecision flagged = new RouteDecision(Intents.GENERAL_CHAT,
            Map.of(RouteDecision.ENTITY_TEMPORAL_REFERENCE, true), List.of("chat_general"), 0.7);
        RouteDecision fromEntity = sanitizer(null).sanitize("hola", flagged);
        assertEquals(List.of("get_current_datetime", "chat_general"), fromEntity.getCandidateTools());

        RouteDecision fromMessage = sanitizer(null).sanitize("¿Qué hacemos mañana?",
            decision(Intents.GENERAL_CHAT, 0.7, "chat_general", "get_current_datetime"));
        assertEquals(List.of("get_current_datetime", "chat_general"), fromMessage.getCandidateTools());
        assertTrue(fromMessage.hasTemporalReference());
    }

    @Test
    void datetimeNotAddedWhenOutOfScope() throws Exception {
        RouteDecision result = sanitizer(List.of("chat_general")).sanitize("¿Qué hacemos hoy?",
            decision(Intents.GENERAL_CHAT, 0.7, "chat_general"));
        assertEquals(List.of("chat_general"), result.getCandidateTools());
        assertTrue(result.hasTemporalReference());
    }

    @Test
    void clampsConfidence() throws Exception {
        DecisionSanitizer sanitizer = sanitizer(null);
        assertEquals(1.0, sanitizer.sanitize("hola", decision(Intents.GENERAL_CHAT, 3.0)).getConfidence(), 1e-9);
        assertEquals(0.05, sanitizer.sanitize("hola", decision(Intents.GENERAL_CHAT, -1.0)).getConfidence(), 1e-9);
        assertEquals(0.05, DecisionSanitizer.clampConfidence(Double.NaN), 1e-9);
        assertEquals(0.42, DecisionSanitizer.clampConfidence(0.42), 1e-9);
    }

    @Test
    void synthesizesClarificationQuestion() throws Exception {
        RouteDecision input = decision(Intents.GENERAL_CHAT, 0.4, "chat_general");
        input.setNeedsClarification(true);
        input.setClarificationQuestion(" ");
        RouteDecision result = sanitizer(null).sanitize("eso", input);
        assertEquals(DecisionSanitizer.DEFAULT_CLARIFICATION_QUESTION, result.getClarificationQuestion());

        input.setClarificationQuestion("¿Qué archivo?");
        assertEquals("¿Qué archivo?", sanitizer(null).sanitize("eso", input).getClarificationQuestion());
    }

    @Test
    void doesNotModifyInput() throws Exception {
        RouteDecision input = decision("memory_wipe", 4.0, "payments_charge");
        sanitizer(null).sanitize("hoy", input);
        assertEquals("memory_wipe", input.getIntent());
        assertEquals(List.of("payments_charge"), input.getCandidateTools());
        assertEquals(4.0, input.getConfidence(), 1e-9);
        assertTrue(input.getEntities().isEmpty());
    }
}
