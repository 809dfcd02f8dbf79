package com.caprouter.guard;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expected shape of a structured model reply, bound to the Java type it maps onto.
 */
public class ResponseSchema<T> {
    private final String name;
    private final Class<T> targetType;
    private final Map<String, FieldSpec> fields = new LinkedHashMap<>();
    // Alias -> canonical field name
    private final Map<String, String> fieldAliases = new LinkedHashMap<>();
    private boolean allowUnknownFields;

    public ResponseSchema(String name, Class<T> targetType) {
        if (targetType == null) {
            throw new IllegalArgumentException("Target type is required");
        }
        this.name = name != null ? name : targetType.getSimpleName();
        this.targetType = targetType;
    }

    public ResponseSchema<T> field(String fieldName, FieldSpec.Type type, boolean required) {
        fields.put(fieldName, new FieldSpec(fieldName, type, required));
        return this;
    }

    public ResponseSchema<T> field(String fieldName, FieldSpec.Type type, boolean required, Set<String> allowedValues) {
        fields.put(fieldName, new FieldSpec(fieldName, type, required, allowedValues, null, null));
        return this;
    }

    public ResponseSchema<T> number(String fieldName, boolean required, Double min, Double max) {
        fields.put(fieldName, new FieldSpec(fieldName, FieldSpec.Type.NUMBER, required, null, min, max));
        return this;
    }

    public ResponseSchema<T> alias(String alias, String canonical) {
        if (alias == null || alias.isBlank() || canonical == null || canonical.isBlank()) {
            return this;
        }
        fieldAliases.put(normalizeKey(alias), canonical);
        return this;
    }

    public ResponseSchema<T> allowUnknownFields(boolean allow) {
        this.allowUnknownFields = allow;
        return this;
    }

    public String getName() {
        return name;
    }

    /**
     * Maps near-miss keys ("Confidence", "candidate-tools ", curated aliases) onto canonical
     * field names. Works on a copy so the parsed tree is left untouched.
     */
    public JsonNode normalize(JsonNode node) {
        if (node == null || !node.isObject()) {
            return node;
        }
        ObjectNode obj = ((ObjectNode) node).deepCopy();
        List<String> keys = new ArrayList<>();
        Iterator<String> it = obj.fieldNames();
        while (it.hasNext()) {
            keys.add(it.next());
        }
        for (String key : keys) {
            if (fields.containsKey(key)) continue;

            String norm = normalizeKey(key);
            String canonical = fields.containsKey(norm) ? norm : fieldAliases.get(norm);
            if (canonical == null || canonical.isBlank()) {
                continue;
            }
            if (!obj.has(canonical)) {
                obj.set(canonical, obj.get(key));
            }
            obj.remove(key);
        }
        return obj;
    }

    private String normalizeKey(String key) {
        if (key == null) return "";
        String k = key.trim().toLowerCase();
        if (k.isEmpty()) return "";
        return k.replace('-', '_').replace(' ', '_');
    }

    /**
     * Returns null when the node satisfies the schema, otherwise the first violation found.
     */
    public String validate(JsonNode node) {
        if (node == null || !node.isObject()) {
            return "not-an-object: expected a JSON object for " + name;
        }
        for (FieldSpec spec : fields.values()) {
            String error = spec.validate(node.get(spec.getName()));
            if (error != null) {
                return error;
            }
        }
        if (!allowUnknownFields) {
            Iterator<String> names = node.fieldNames();
            while (names.hasNext()) {
                String field = names.next();
                if (!fields.containsKey(field)) {
                    return "unknown-field:" + field;
                }
            }
        }
        return null;
    }

    public T convert(JsonNode node, ObjectMapper mapper) throws JsonProcessingException {
        return mapper.treeToValue(node, targetType);
    }
}
