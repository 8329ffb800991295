package com.richcorabbithole.pipeline.research;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.richcorabbithole.pipeline.shared.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Calls the Anthropic Messages API over HTTP.
 */
public class AnthropicResearchClient implements ResearchProvider {

    private static final Logger logger = LoggerFactory.getLogger(AnthropicResearchClient.class);

    // Config keys
    private static final String MODEL_KEY = "ANTHROPIC_MODEL";
    private static final String MAX_TOKENS_KEY = "ANTHROPIC_MAX_TOKENS";
    private static final String BASE_URL_KEY = "ANTHROPIC_BASE_URL";

    public static final String DEFAULT_MODEL = "claude-sonnet-4-20250514";
    public static final int DEFAULT_MAX_TOKENS = 4096;
    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    static final String API_VERSION = "2023-06-01";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI messagesUri;
    private final String model;
    private final int maxTokens;

    public AnthropicResearchClient(HttpClient httpClient, String baseUrl, String model, int maxTokens) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.messagesUri = URI.create(baseUrl.replaceAll("/+$", "") + "/v1/messages");
        this.model = model;
        this.maxTokens = maxTokens;
    }

    public static AnthropicResearchClient fromConfig(AppConfig config) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .build();
        return new AnthropicResearchClient(
                httpClient,
                config.getOptional(BASE_URL_KEY, DEFAULT_BASE_URL),
                config.getOptional(MODEL_KEY, DEFAULT_MODEL),
                config.getIntOptional(MAX_TOKENS_KEY, DEFAULT_MAX_TOKENS));
    }

    @Override
    public ResearchResponse createMessage(String apiKey, String systemPrompt, String userMessage) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(messagesUri)
                .header("Content-Type", "application/json")
                .header("x-api-key", apiKey)
                .header("anthropic-version", API_VERSION)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(systemPrompt, userMessage)))
                .build();

        HttpResponse<String> response;
        try {
            logger.debug("Calling {} with model {}", messagesUri, model);
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ResearchProviderException("Anthropic API request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResearchProviderException("Interrupted while calling Anthropic API", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new ResearchProviderException(
                    "Anthropic API error " + status + ": " + errorMessage(response.body()), status, null);
        }
        return parseResponse(response.body());
    }

    String requestBody(String systemPrompt, String userMessage) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", maxTokens);
        body.put("system", systemPrompt);
        ObjectNode message = body.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", userMessage);
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize Anthropic request", e);
        }
    }

    ResearchResponse parseResponse(String body) {
        try {
            ResearchResponse response = objectMapper.readValue(body, ResearchResponse.class);
            logger.debug("Anthropic returned {} content blocks, stop_reason={}",
                    response.getContent().size(), response.getStopReason());
            return response;
        } catch (JsonProcessingException e) {
            throw new ResearchProviderException("Anthropic API returned an unreadable response", e);
        }
    }

    /**
     * Pulls error.message out of an Anthropic error body, falling back to the raw body.
     */
    private String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "(empty body)";
        }
        try {
            JsonNode message = objectMapper.readTree(body).path("error").path("message");
            if (message.isTextual()) {
                return message.asText();
            }
        } catch (JsonProcessingException e) {
            logger.debug("Anthropic error body is not JSON");
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }
}
