package com.caprouter.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal JSON-schema descriptor attached to a capability for auditability.
 * Not enforced at routing time.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CapabilitySchema {

    private String type = "object";
    private List<String> required = new ArrayList<>();
    private Map<String, Object> properties = new LinkedHashMap<>();

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public List<String> getRequired() {
        return required;
    }

    public void setRequired(List<String> required) {
        this.required = required;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }

    public void setProperties(Map<String, Object> properties) {
        this.properties = properties;
    }

    public CapabilitySchema copy() {
        CapabilitySchema copy = new CapabilitySchema();
        copy.type = type;
        copy.required = required != null ? new ArrayList<>(required) : new ArrayList<>();
        copy.properties = properties != null ? new LinkedHashMap<>(properties) : new LinkedHashMap<>();
        return copy;
    }
}
