package com.caprouter.llm;

import com.caprouter.AppLogger;
import com.caprouter.models.ChatMessage;
import com.caprouter.models.ModelEndpointConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for HTTP model clients with shared request and retry logic.
 */
public abstract class AbstractModelClient implements ModelClient {

    protected static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 120;
    private static final int HTTP_RETRIES = 2;
    private static final Pattern STATUS_CODE = Pattern.compile("\\((\\d{3})\\)");

    protected final ObjectMapper mapper;
    protected final HttpClient httpClient;
    protected final ModelEndpointConfig endpoint;

    protected AbstractModelClient(ObjectMapper mapper, HttpClient httpClient, ModelEndpointConfig endpoint) {
        if (endpoint == null) {
            throw new IllegalArgumentException("Endpoint configuration is required");
        }
        if (endpoint.getModel() == null || endpoint.getModel().isBlank()) {
            throw new IllegalArgumentException("Model is required");
        }
        this.mapper = mapper;
        this.httpClient = httpClient;
        this.endpoint = endpoint;
    }

    protected ArrayNode appendMessages(ObjectNode payload, List<ChatMessage> messages, String systemPrompt) {
        ArrayNode array = payload.putArray("messages");
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            ObjectNode system = array.addObject();
            system.put("role", ChatMessage.ROLE_SYSTEM);
            system.put("content", systemPrompt);
        }
        if (messages != null) {
            for (ChatMessage message : messages) {
                if (message == null) continue;
                ObjectNode node = array.addObject();
                node.put("role", message.getRole() != null ? message.getRole() : ChatMessage.ROLE_USER);
                node.put("content", message.getContent() != null ? message.getContent() : "");
            }
        }
        return array;
    }

    /**
     * Send a JSON POST request and return the parsed response.
     */
    protected JsonNode sendJsonPost(String url, JsonNode payload, String bearerAuth)
        throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(resolveTimeout(endpoint.getTimeoutMs()))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)));

        if (bearerAuth != null && !bearerAuth.isBlank()) {
            builder.header("Authorization", bearerAuth);
        }

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("Model request failed (" + status + "): " + response.body());
        }
        return mapper.readTree(response.body());
    }

    /**
     * Retries transient network/provider failures with backoff; anything else is rethrown at once.
     */
    protected JsonNode sendJsonPostWithRetries(String url, JsonNode payload, String bearerAuth)
        throws IOException, InterruptedException {
        int retries = HTTP_RETRIES;
        IOException lastIo = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                return sendJsonPost(url, payload, bearerAuth);
            } catch (IOException e) {
                lastIo = e;
                if (attempt >= retries || !isRetryableFailure(e)) {
                    AppLogger logger = AppLogger.get();
                    if (logger != null) {
                        logger.error("Model request to " + url + " failed: " + e.getMessage());
                    }
                    throw e;
                }
                sleepBackoff(attempt);
            }
        }
        throw lastIo != null ? lastIo : new IOException("Model request failed");
    }

    private boolean isRetryableFailure(IOException e) {
        String msg = e.getMessage() != null ? e.getMessage() : "";
        if (msg.contains("EOF reached while reading")) return true;
        if (msg.contains("Connection reset")) return true;
        if (msg.contains("timed out") || msg.contains("Timeout")) return true;
        Matcher m = STATUS_CODE.matcher(msg);
        if (m.find()) {
            int code = Integer.parseInt(m.group(1));
            return code == 429 || (code >= 500 && code <= 599);
        }
        return false;
    }

    private void sleepBackoff(int attempt) throws InterruptedException {
        // 350ms, 900ms, 1800ms, then +1200ms per attempt, plus jitter
        long base;
        if (attempt <= 0) base = 350;
        else if (attempt == 1) base = 900;
        else if (attempt == 2) base = 1800;
        else base = 2800L + 1200L * (attempt - 3);
        long jitter = ThreadLocalRandom.current().nextLong(0, 220);
        Thread.sleep(Math.min(10_000, base + jitter));
    }

    protected Duration resolveTimeout(Integer timeoutMs) {
        if (timeoutMs != null && timeoutMs > 0) {
            return Duration.ofMillis(timeoutMs);
        }
        return Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS);
    }

    /**
     * Normalize a base URL by removing trailing slashes.
     */
    protected String normalizeBaseUrl(String baseUrl, String fallback) {
        String url = (baseUrl == null || baseUrl.isBlank()) ? fallback : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }
}
