package com.caprouter.llm;

import com.caprouter.models.ChatMessage;
import com.caprouter.models.ModelEndpointConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.http.HttpClient;
import java.util.List;
import java.util.regex.Pattern;

public class OllamaModelClient extends AbstractModelClient {

    static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final Pattern THINK_BLOCK = Pattern.compile("<think>[\\s\\S]*?</think>\\s*");

    public OllamaModelClient(ObjectMapper mapper, HttpClient httpClient, ModelEndpointConfig endpoint) {
        super(mapper, httpClient, endpoint);
    }

    @Override
    public String generate(List<ChatMessage> messages, String systemPrompt)
        throws IOException, InterruptedException {
        String url = normalizeBaseUrl(endpoint.getBaseUrl(), DEFAULT_BASE_URL) + "/api/chat";

        JsonNode response = sendJsonPostWithRetries(url, buildPayload(messages, systemPrompt), null);
        return extractContent(response);
    }

    ObjectNode buildPayload(List<ChatMessage> messages, String systemPrompt) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", endpoint.getModel());
        payload.put("stream", false);
        appendMessages(payload, messages, systemPrompt);
        if (endpoint.getTemperature() != null) {
            ObjectNode options = payload.putObject("options");
            options.put("temperature", endpoint.getTemperature());
        }
        return payload;
    }

    static String extractContent(JsonNode response) {
        JsonNode content = response.path("message").path("content");
        if (!content.isMissingNode()) {
            return stripThinking(content.asText());
        }
        JsonNode text = response.path("response");
        if (!text.isMissingNode()) {
            return stripThinking(text.asText());
        }
        return response.toString();
    }

    static String stripThinking(String text) {
        if (text == null || !text.contains("<think>")) {
            return text;
        }
        return THINK_BLOCK.matcher(text).replaceAll("").trim();
    }
}
