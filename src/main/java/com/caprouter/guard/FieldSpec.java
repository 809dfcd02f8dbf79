package com.caprouter.guard;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

public class FieldSpec {
    public enum Type {
        STRING,
        NUMBER,
        BOOLEAN,
        STRING_ARRAY,
        OBJECT
    }

    private final String name;
    private final Type type;
    private final boolean required;
    private final Set<String> allowedValues;
    private final Double min;
    private final Double max;

    public FieldSpec(String name, Type type, boolean required) {
        this(name, type, required, null, null, null);
    }

    public FieldSpec(String name, Type type, boolean required, Set<String> allowedValues, Double min, Double max) {
        this.name = name;
        this.type = type;
        this.required = required;
        this.allowedValues = allowedValues;
        this.min = min;
        this.max = max;
    }

    public String getName() {
        return name;
    }

    /**
     * Returns null when the node satisfies this field, otherwise an error code naming the field.
     */
    public String validate(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return required ? "missing-required:" + name : null;
        }
        // Present-but-null never falls back to the default.
        if (node.isNull()) {
            return required ? "missing-required:" + name : "invalid-type:" + name + " (null not allowed)";
        }
        switch (type) {
            case STRING:
                if (!node.isTextual()) {
                    return "invalid-type:" + name + " (expected string)";
                }
                if (allowedValues != null && !allowedValues.isEmpty() && !allowedValues.contains(node.asText())) {
                    return "invalid-enum:" + name + " (got '" + node.asText() + "')";
                }
                return null;
            case NUMBER:
                if (!node.isNumber()) {
                    return "invalid-type:" + name + " (expected number)";
                }
                double value = node.asDouble();
                if ((min != null && value < min) || (max != null && value > max)) {
                    return "out-of-range:" + name + " (got " + value + ", expected "
                        + (min != null ? min : "-inf") + ".." + (max != null ? max : "inf") + ")";
                }
                return null;
            case BOOLEAN:
                return node.isBoolean() ? null : "invalid-type:" + name + " (expected boolean)";
            case STRING_ARRAY:
                if (!node.isArray()) {
                    return "invalid-type:" + name + " (expected array of strings)";
                }
                for (JsonNode child : node) {
                    if (!child.isTextual()) {
                        return "invalid-type:" + name + " (expected array of strings)";
                    }
                }
                return null;
            case OBJECT:
                return node.isObject() ? null : "invalid-type:" + name + " (expected object)";
            default:
                return "invalid-type:" + name;
        }
    }
}
