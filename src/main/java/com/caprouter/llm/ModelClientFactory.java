package com.caprouter.llm;

import com.caprouter.models.ModelEndpointConfig;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Creates the model client matching an endpoint's provider, sharing one HTTP client.
 */
public class ModelClientFactory {

    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    public ModelClientFactory(ObjectMapper mapper) {
        this.mapper = mapper;
        this.httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    /**
     * Ollama gets its native client; every other provider name speaks the OpenAI-compatible protocol.
     */
    public ModelClient create(ModelEndpointConfig endpoint) {
        if (endpoint == null) {
            throw new IllegalArgumentException("Endpoint configuration is required");
        }
        String provider = endpoint.getProvider();
        if (provider == null || provider.isBlank()) {
            provider = "ollama";
        }
        if ("ollama".equals(provider)) {
            return new OllamaModelClient(mapper, httpClient, endpoint);
        }
        return new OpenAiCompatibleModelClient(mapper, httpClient, endpoint);
    }
}
