package com.caprouter.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class CapabilityDefinition {

    private String id;
    private Integer phase;
    private String provider;
    private String summary;
    @JsonProperty("input_schema")
    private CapabilitySchema inputSchema;
    @JsonProperty("output_schema")
    private CapabilitySchema outputSchema;
    @JsonProperty("fallback_to")
    private List<String> fallbackTo = Collections.emptyList();

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Integer getPhase() {
        return phase;
    }

    public void setPhase(Integer phase) {
        this.phase = phase;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public CapabilitySchema getInputSchema() {
        return inputSchema;
    }

    public void setInputSchema(CapabilitySchema inputSchema) {
        this.inputSchema = inputSchema;
    }

    public CapabilitySchema getOutputSchema() {
        return outputSchema;
    }

    public void setOutputSchema(CapabilitySchema outputSchema) {
        this.outputSchema = outputSchema;
    }

    /**
     * Never null and not modifiable.
     */
    public List<String> getFallbackTo() {
        return fallbackTo;
    }

    public void setFallbackTo(List<String> fallbackTo) {
        List<String> ids = new ArrayList<>();
        if (fallbackTo != null) {
            for (String id : fallbackTo) {
                if (id != null && !id.isBlank()) {
                    ids.add(id.trim());
                }
            }
        }
        this.fallbackTo = Collections.unmodifiableList(ids);
    }

    public CapabilityDefinition copy() {
        CapabilityDefinition copy = new CapabilityDefinition();
        copy.id = id;
        copy.phase = phase;
        copy.provider = provider;
        copy.summary = summary;
        copy.inputSchema = inputSchema != null ? inputSchema.copy() : null;
        copy.outputSchema = outputSchema != null ? outputSchema.copy() : null;
        copy.fallbackTo = fallbackTo;
        return copy;
    }
}
