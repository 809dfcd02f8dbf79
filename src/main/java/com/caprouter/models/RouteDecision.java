package com.caprouter.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured routing outcome: intent, extracted entities and ranked candidate capability ids.
 * Field names on the wire are snake_case, matching what the classifier model is asked to emit.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RouteDecision {

    public static final String ENTITY_TEMPORAL_REFERENCE = "temporal_reference";
    public static final String ENTITY_QUERY = "query";
    public static final String ENTITY_PREFER_NEWS = "prefer_news";

    private String intent = "general_chat";
    private Map<String, Object> entities = new LinkedHashMap<>();
    @JsonProperty("candidate_tools")
    private List<String> candidateTools = new ArrayList<>(List.of("chat_general"));
    private double confidence = 0.5;
    @JsonProperty("needs_clarification")
    private boolean needsClarification;
    @JsonProperty("clarification_question")
    private String clarificationQuestion = "";

    public RouteDecision() {}

    public RouteDecision(String intent, Map<String, Object> entities, List<String> candidateTools, double confidence) {
        this.intent = intent;
        this.entities = entities != null ? new LinkedHashMap<>(entities) : new LinkedHashMap<>();
        this.candidateTools = candidateTools != null ? new ArrayList<>(candidateTools) : new ArrayList<>();
        this.confidence = confidence;
    }

    public String getIntent() {
        return intent;
    }

    public void setIntent(String intent) {
        this.intent = intent;
    }

    public Map<String, Object> getEntities() {
        return entities;
    }

    public void setEntities(Map<String, Object> entities) {
        this.entities = entities != null ? new LinkedHashMap<>(entities) : new LinkedHashMap<>();
    }

    public List<String> getCandidateTools() {
        return candidateTools;
    }

    public void setCandidateTools(List<String> candidateTools) {
        this.candidateTools = candidateTools != null ? new ArrayList<>(candidateTools) : new ArrayList<>();
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public boolean isNeedsClarification() {
        return needsClarification;
    }

    public void setNeedsClarification(boolean needsClarification) {
        this.needsClarification = needsClarification;
    }

    public String getClarificationQuestion() {
        return clarificationQuestion;
    }

    public void setClarificationQuestion(String clarificationQuestion) {
        this.clarificationQuestion = clarificationQuestion;
    }

    @JsonIgnore
    public boolean hasTemporalReference() {
        Object value = entities != null ? entities.get(ENTITY_TEMPORAL_REFERENCE) : null;
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && "true".equalsIgnoreCase(value.toString().trim());
    }

    @JsonIgnore
    public String getQuery() {
        Object value = entities != null ? entities.get(ENTITY_QUERY) : null;
        return value != null ? value.toString().trim() : "";
    }

    public RouteDecision copy() {
        RouteDecision copy = new RouteDecision(intent, entities, candidateTools, confidence);
        copy.setNeedsClarification(needsClarification);
        copy.setClarificationQuestion(clarificationQuestion);
        return copy;
    }

    @Override
    public String toString() {
        return "RouteDecision{intent=" + intent + ", confidence=" + confidence
            + ", candidateTools=" + candidateTools + "}";
    }
}
