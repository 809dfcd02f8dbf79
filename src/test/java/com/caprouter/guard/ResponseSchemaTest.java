package com.caprouter.guard;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ResponseSchemaTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private ResponseSchema<JsonNode> schema() {
        return new ResponseSchema<>("Verdict", JsonNode.class)
            .field("label", FieldSpec.Type.STRING, true, Set.of("yes", "no"))
            .number("score", false, 0.0, 1.0)
            .field("tags", FieldSpec.Type.STRING_ARRAY, false)
            .alias("verdict", "label");
    }

    private String check(String json) throws Exception {
        ResponseSchema<JsonNode> schema = schema();
        return schema.validate(schema.normalize(mapper.readTree(json)));
    }

    @Test
    void acceptsValidObject() throws Exception {
        assertNull(check("{\"label\": \"yes\", \"score\": 0.4, \"tags\": [\"a\"]}"));
    }

    @Test
    void normalizesKeyCaseAndAliases() throws Exception {
        ResponseSchema<JsonNode> schema = schema();
        JsonNode original = mapper.readTree("{\"Verdict\": \"no\", \"SCORE\": 1}");
        JsonNode normalized = schema.normalize(original);
        assertNull(schema.validate(normalized));
        assertEquals("no", normalized.get("label").asText());
        assertTrue(original.has("Verdict"));
    }

    @Test
    void reportsViolations() throws Exception {
        assertEquals("missing-required:label", check("{\"score\": 0.2}"));
        assertTrue(check("{\"label\": \"maybe\"}").startsWith("invalid-enum:label"));
        assertTrue(check("{\"label\": \"yes\", \"score\": 1.5}").startsWith("out-of-range:score"));
        assertTrue(check("{\"label\": \"yes\", \"score\": \"high\"}").startsWith("invalid-type:score"));
        assertTrue(check("{\"label\": \"yes\", \"tags\": [1]}").startsWith("invalid-type:tags"));
        assertTrue(check("{\"label\": \"yes\", \"score\": null}").startsWith("invalid-type:score"));
        assertEquals("unknown-field:extra", check("{\"label\": \"yes\", \"extra\": 1}"));
        assertTrue(check("[1, 2]").startsWith("not-an-object"));
    }

    @Test
    void unknownFieldsCanBeAllowed() throws Exception {
        ResponseSchema<JsonNode> schema = schema().allowUnknownFields(true);
        assertNull(schema.validate(mapper.readTree("{\"label\": \"yes\", \"extra\": 1}")));
    }
}
