package com.caprouter.llm;

import com.caprouter.models.ChatMessage;
import com.caprouter.models.ModelEndpointConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.http.HttpClient;
import java.util.List;

/**
 * Client for any server speaking the OpenAI chat-completions protocol
 * (openai, lmstudio, togetherai, vLLM, custom gateways).
 */
public class OpenAiCompatibleModelClient extends AbstractModelClient {

    static final String LOCAL_BASE_URL = "http://localhost:1234";

    public OpenAiCompatibleModelClient(ObjectMapper mapper, HttpClient httpClient, ModelEndpointConfig endpoint) {
        super(mapper, httpClient, endpoint);
    }

    @Override
    public String generate(List<ChatMessage> messages, String systemPrompt)
        throws IOException, InterruptedException {
        String url = normalizeOpenAiBaseUrl(endpoint.getBaseUrl(), defaultBaseUrl(endpoint.getProvider()))
            + "/v1/chat/completions";

        ObjectNode payload = buildPayload(messages, systemPrompt);
        String apiKey = endpoint.getApiKey();
        JsonNode response = sendJsonPostWithRetries(url, payload,
            apiKey == null || apiKey.isBlank() ? null : "Bearer " + apiKey);
        return extractContent(response);
    }

    ObjectNode buildPayload(List<ChatMessage> messages, String systemPrompt) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", endpoint.getModel());
        appendMessages(payload, messages, systemPrompt);
        if (endpoint.getTemperature() != null) {
            payload.put("temperature", endpoint.getTemperature());
        }
        return payload;
    }

    static String extractContent(JsonNode response) {
        JsonNode choices = response.path("choices");
        if (choices.isArray() && choices.size() > 0) {
            JsonNode choice = choices.get(0);
            JsonNode content = choice.path("message").path("content");
            if (!content.isMissingNode() && !content.asText().isBlank()) {
                return content.asText();
            }
            JsonNode text = choice.path("text");
            if (!text.isMissingNode()) {
                return text.asText();
            }
        }
        return response.toString();
    }

    /**
     * Hosted providers have known endpoints; anything else is assumed to be a local LM Studio style server.
     */
    static String defaultBaseUrl(String provider) {
        if ("openai".equals(provider)) {
            return "https://api.openai.com";
        }
        if ("togetherai".equals(provider)) {
            return "https://api.together.xyz";
        }
        return LOCAL_BASE_URL;
    }

    private String normalizeOpenAiBaseUrl(String baseUrl, String fallback) {
        String url = normalizeBaseUrl(baseUrl, fallback);
        if (url.endsWith("/v1")) {
            url = url.substring(0, url.length() - 3);
        }
        return url;
    }
}
