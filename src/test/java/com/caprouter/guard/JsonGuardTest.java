package com.caprouter.guard;

import com.caprouter.FakeModelClient;
import com.caprouter.llm.ModelClient;
import com.caprouter.models.ChatMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JsonGuardTest {

    public static class Verdict {
        public String label;
        public double score;
    }

    private static final ResponseSchema<Verdict> SCHEMA = new ResponseSchema<>("Verdict", Verdict.class)
        .field("label", FieldSpec.Type.STRING, true, Set.of("yes", "no"))
        .number("score", true, 0.0, 1.0);

    private static final String VALID = "{\"label\": \"yes\", \"score\": 0.9}";

    @Test
    void returnsFirstValidReplyWithoutRetrying() {
        FakeModelClient model = new FakeModelClient(VALID);
        JsonGuardResult<Verdict> result = new JsonGuard(model, new ObjectMapper()).generate("sys", "user", SCHEMA);

        assertTrue(result.isPresent());
        assertEquals("yes", result.getValue().get().label);
        assertEquals(1, result.getTrace().getAttempts());
        assertEquals(1, model.getCallCount());
    }

    @Test
    void retriesUntilValid() {
        FakeModelClient model = new FakeModelClient("not json", "{\"label\": \"maybe\", \"score\": 0.5}", VALID);
        JsonGuardResult<Verdict> result = new JsonGuard(model, new ObjectMapper()).generate("sys", "user", SCHEMA, 2);

        assertTrue(result.isPresent());
        assertEquals(0.9, result.getValue().get().score, 1e-9);
        assertEquals(3, result.getTrace().getOutputs().size());
    }

    @Test
    void givesUpAfterMaxRetries() {
        FakeModelClient model = new FakeModelClient("nope", "still nope", "{\"label\": \"yes\"}");
        JsonGuardResult<Verdict> result = new JsonGuard(model, new ObjectMapper()).generate("sys", "user", SCHEMA, 2);

        assertFalse(result.isPresent());
        assertTrue(result.getValue().isEmpty());
        assertEquals(3, result.getTrace().getOutputs().size());
        assertEquals(List.of("nope", "still nope", "{\"label\": \"yes\"}"), result.getTrace().getOutputs());
        assertEquals("missing-required:score", result.getTrace().getLastError());
        assertEquals(3, model.getCallCount());
    }

    @Test
    void zeroRetriesMeansSingleAttempt() {
        FakeModelClient model = new FakeModelClient("nope", VALID);
        JsonGuardResult<Verdict> result = new JsonGuard(model, new ObjectMapper()).generate("sys", "user", SCHEMA, 0);

        assertFalse(result.isPresent());
        assertEquals(1, model.getCallCount());
        assertEquals(JsonGuard.NO_OBJECT_ERROR, result.getTrace().getLastError());
    }

    @Test
    void repairsFencedReplyWithTrailingCommaLocally() {
        FakeModelClient model = new FakeModelClient("```json\n{\"label\": \"no\", \"score\": 0.2,}\n```");
        JsonGuardResult<Verdict> result = new JsonGuard(model, new ObjectMapper()).generate("sys", "user", SCHEMA);

        assertTrue(result.isPresent());
        assertEquals("no", result.getValue().get().label);
        assertEquals(1, model.getCallCount());
    }

    @Test
    void extractsObjectSurroundedByProse() {
        FakeModelClient model = new FakeModelClient("Sure! Here it is: " + VALID + " Hope that helps.");
        JsonGuardResult<Verdict> result = new JsonGuard(model, new ObjectMapper()).generate("sys", "user", SCHEMA);
        assertTrue(result.isPresent());
    }

    @Test
    void retryShowsPreviousReplyAndError() {
        FakeModelClient model = new FakeModelClient("{\"label\": \"yes\", \"score\": 7}", VALID);
        new JsonGuard(model, new ObjectMapper()).generate("Classify things.", "Is it?", SCHEMA);

        assertTrue(model.getSystemPrompt(0).startsWith("Classify things."));
        assertTrue(model.getSystemPrompt(0).contains(JsonGuard.JSON_ONLY_INSTRUCTION));
        assertEquals(1, model.getCall(0).size());

        List<ChatMessage> retry = model.getCall(1);
        assertEquals(3, retry.size());
        assertEquals("Is it?", retry.get(0).getContent());
        assertEquals(ChatMessage.ROLE_ASSISTANT, retry.get(1).getRole());
        assertEquals("{\"label\": \"yes\", \"score\": 7}", retry.get(1).getContent());
        assertEquals(ChatMessage.ROLE_USER, retry.get(2).getRole());
        assertTrue(retry.get(2).getContent().contains("out-of-range:score"));
    }

    @Test
    void ignoresStrayBraceAfterObject() {
        FakeModelClient model = new FakeModelClient("{\"label\": \"yes\", \"score\": 0.5} }");
        JsonGuardResult<Verdict> result = new JsonGuard(model, new ObjectMapper()).generate("sys", "user", SCHEMA, 0);
        assertTrue(result.isPresent());
    }

    @Test
    void modelFailureEndsWithEmptyResult() {
        ModelClient failing = (messages, systemPrompt) -> {
            throw new IOException("connection refused");
        };
        JsonGuardResult<Verdict> result = new JsonGuard(failing, new ObjectMapper()).generate("sys", "user", SCHEMA);

        assertFalse(result.isPresent());
        assertEquals(0, result.getTrace().getAttempts());
        assertEquals("model-call-failed: connection refused", result.getTrace().getLastError());
    }

    @Test
    void requiresModelClientAndSchema() {
        assertThrows(IllegalArgumentException.class, () -> new JsonGuard(null, new ObjectMapper()));
        JsonGuard guard = new JsonGuard(new FakeModelClient(VALID), null);
        assertThrows(IllegalArgumentException.class, () -> guard.generate("sys", "user", null));
    }
}
