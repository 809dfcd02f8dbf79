package com.caprouter.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Connection settings for the text-generation model behind the router.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelEndpointConfig {

    private String provider = "ollama";
    private String model;
    private String baseUrl;
    private String apiKey;
    private Double temperature;
    private Integer timeoutMs;

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public Double getTemperature() {
        return temperature;
    }

    public void setTemperature(Double temperature) {
        this.temperature = temperature;
    }

    public Integer getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(Integer timeoutMs) {
        this.timeoutMs = timeoutMs;
    }
}
