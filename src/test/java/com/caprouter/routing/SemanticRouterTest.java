package com.caprouter.routing;

import com.caprouter.FakeModelClient;
import com.caprouter.TestDocuments;
import com.caprouter.capabilities.CapabilityRegistry;
import com.caprouter.capabilities.ProductScope;
import com.caprouter.guard.JsonGuard;
import com.caprouter.models.ChatMessage;
import com.caprouter.models.RouteDecision;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SemanticRouterTest {

    @TempDir
    Path tempDir;

    private SemanticRouter router(FakeModelClient model, ProductScope scope) throws Exception {
        CapabilityRegistry registry = new CapabilityRegistry(TestDocuments.bundledCapabilities(tempDir), scope);
        return new SemanticRouter(registry, scope, new JsonGuard(model, new ObjectMapper()));
    }

    private SemanticRouter fullScopeRouter(FakeModelClient model) throws Exception {
        return router(model, new ProductScope(TestDocuments.bundledScope(tempDir)));
    }

    private static RouteDecision withConfidence(String intent, double confidence) {
        return new RouteDecision(intent, Map.of(), List.of("chat_general"), confidence);
    }

    @Test
    void heuristicWinsWhenSemanticIsMeaningfullyWorse() {
        RouteDecision heuristic = withConfidence(Intents.WEB_SEARCH, 0.80);
        RouteDecision semantic = withConfidence(Intents.GENERAL_CHAT, 0.60);
        assertSame(heuristic, SemanticRouter.fuse(heuristic, Optional.of(semantic)));
    }

    @Test
    void semanticWinsWithinMargin() {
        RouteDecision heuristic = withConfidence(Intents.WEB_SEARCH, 0.80);
        assertEquals(Intents.GENERAL_CHAT,
            SemanticRouter.fuse(heuristic, Optional.of(withConfidence(Intents.GENERAL_CHAT, 0.75))).getIntent());
        assertEquals(Intents.GENERAL_CHAT,
            SemanticRouter.fuse(heuristic, Optional.of(withConfidence(Intents.GENERAL_CHAT, 0.70))).getIntent());
    }

    @Test
    void semanticNeedsMinimumConfidence() {
        RouteDecision heuristic = withConfidence(Intents.GENERAL_CHAT, 0.30);
        assertSame(heuristic, SemanticRouter.fuse(heuristic, Optional.of(withConfidence(Intents.WEB_SEARCH, 0.34))));
        assertSame(heuristic, SemanticRouter.fuse(heuristic, Optional.empty()));
    }

    @Test
    void invalidModelOutputFallsBackToHeuristicWithTemporalDatetime() throws Exception {
        FakeModelClient model = new FakeModelClient("I think you want the weather!");
        ProductScope scope = ProductScope.of(List.of("web_search_general", "get_current_datetime", "chat_general"));
        List<ChatMessage> history = List.of(
            ChatMessage.user("¿Qué día es hoy?"),
            ChatMessage.assistant("Hoy es lunes."));

        RouteDecision decision = router(model, scope).route("Busca el clima hoy en Pamplona", history);

        assertEquals(Intents.WEB_SEARCH, decision.getIntent());
        assertEquals(List.of("get_current_datetime", "web_search_general", "chat_general"), decision.getCandidateTools());
        assertEquals(Boolean.TRUE, decision.getEntities().get(RouteDecision.ENTITY_TEMPORAL_REFERENCE));
        assertEquals("el clima hoy en pamplona", decision.getQuery());
        assertEquals(3, model.getCallCount());
        assertTrue(model.getCall(0).get(0).getContent().contains("Hoy es lunes."));
    }

    @Test
    void emptyScopeRoutesToNothing() throws Exception {
        FakeModelClient model = new FakeModelClient("{\"intent\": \"general_chat\", \"confidence\": 0.9}");
        RouteDecision decision = router(model, ProductScope.of(List.of())).route("Busca el clima hoy", List.of());

        assertTrue(decision.getCandidateTools().isEmpty());
        assertEquals(0, model.getCallCount());
    }

    @Test
    void confidentSemanticDecisionOverridesHeuristic() throws Exception {
        FakeModelClient model = new FakeModelClient(
            "{\"intent\": \"reminder_management\", \"candidate_tools\": [\"reminder_list\"], \"confidence\": 0.9}");
        RouteDecision decision = fullScopeRouter(model).route("¿Qué tengo para luego?", List.of());

        assertEquals(Intents.REMINDER_MANAGEMENT, decision.getIntent());
        assertEquals(List.of("reminder_list"), decision.getCandidateTools());
        assertEquals(0.9, decision.getConfidence(), 1e-9);
    }

    @Test
    void unconfidentSemanticDecisionIsIgnored() throws Exception {
        FakeModelClient model = new FakeModelClient(
            "{\"intent\": \"general_chat\", \"candidate_tools\": [\"chat_general\"], \"confidence\": 0.5}");
        RouteDecision decision = fullScopeRouter(model).route("Busca el clima en Pamplona", List.of());

        assertEquals(Intents.WEB_SEARCH, decision.getIntent());
        assertEquals("web_search_general", decision.getCandidateTools().get(0));
        assertEquals(0.78, decision.getConfidence(), 1e-9);
    }

    @Test
    void semanticSynonymIsCanonicalized() throws Exception {
        FakeModelClient model = new FakeModelClient(
            "{\"intent\": \"memory_forget\", \"tools\": [\"chat_general\"], \"confidence\": 0.8}");
        RouteDecision decision = fullScopeRouter(model).route("Olvida el dato de mi trabajo", List.of());

        assertEquals(Intents.MEMORY_DELETE, decision.getIntent());
        assertEquals(List.of("memory_delete_user_fact", "chat_general"), decision.getCandidateTools());
    }

    @Test
    void outOfScopeProposalFallsBackToChat() throws Exception {
        FakeModelClient model = new FakeModelClient(
            "{\"intent\": \"web_search\", \"candidate_tools\": [\"payments_charge\"], \"confidence\": 0.95}");
        RouteDecision decision = router(model, ProductScope.of(List.of("chat_general"))).route("Hola", List.of());

        assertEquals(Intents.WEB_SEARCH, decision.getIntent());
        assertEquals(List.of("chat_general"), decision.getCandidateTools());
    }

    @Test
    void modelFailureStillRoutes() throws Exception {
        CapabilityRegistry registry = new CapabilityRegistry(TestDocuments.bundledCapabilities(tempDir), null);
        ProductScope scope = ProductScope.of(registry.allIds());
        JsonGuard guard = new JsonGuard((messages, systemPrompt) -> {
            throw new IOException("timeout");
        }, new ObjectMapper());
        RouteDecision decision = new SemanticRouter(registry, scope, guard).route("Recuérdame pagar la luz", null);

        assertEquals(Intents.REMINDER_MANAGEMENT, decision.getIntent());
        assertEquals("reminder_create", decision.getCandidateTools().get(0));
    }
}
