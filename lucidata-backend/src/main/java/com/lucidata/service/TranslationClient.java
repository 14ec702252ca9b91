package com.lucidata.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lucidata.config.LucidataConfig;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sends a rendered prompt to an OpenAI-compatible chat completion endpoint and returns the raw
 * response text.
 *
 * <p>Uses plain HTTP requests (no vendor SDK). Failures are reported as {@link ProviderException} and
 * never retried here; a truncated completion is returned as-is.
 */
@Service
public class TranslationClient {

    private static final Logger log = LoggerFactory.getLogger(TranslationClient.class);

    static final String SYSTEM_PROMPT = "You are a helpful assistant that translates natural language questions "
            + "into SQL queries for a PostgreSQL database.";
    static final double TEMPERATURE = 0.1;
    static final int MAX_TOKENS = 500;

    private static final String COMPLETIONS_PATH = "/v1/chat/completions";
    private static final int MAX_ERROR_BODY_CHARS = 300;

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final LucidataConfig.Llm config;

    /**
     * Create a translation client.
     *
     * @param objectMapper Jackson object mapper
     * @param httpClient HTTP client used for completion calls
     * @param config process configuration
     */
    public TranslationClient(ObjectMapper objectMapper, HttpClient httpClient, LucidataConfig config) {
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.config = config.llm();
    }

    /**
     * Log whether translation is enabled. Never logs the API key.
     */
    @PostConstruct
    public void logConfigStatus() {
        if (config.isEnabled()) {
            log.info("SQL translation is ENABLED (base_url={}, default_model={})", config.baseUrl(), config.model());
            return;
        }
        log.warn("SQL translation is DISABLED (base_url={}, api_key_configured=false); set LLM_API_KEY to enable",
                config.baseUrl());
    }

    /**
     * Resolve the model for a request.
     *
     * @param requested model named by the caller, may be null or blank
     * @return requested model, or the configured default
     */
    public String resolveModel(String requested) {
        if (requested == null || requested.isBlank()) {
            return config.model();
        }
        return requested.trim();
    }

    /**
     * Run one completion.
     *
     * @param prompt rendered prompt, sent as the only user message
     * @param modelName model to use, or null for the default
     * @return raw completion text
     * @throws ProviderException on configuration, network, authentication, quota or protocol failures
     */
    public String translate(String prompt, String modelName) throws ProviderException {
        if (!config.isEnabled()) {
            throw new ProviderException(ProviderException.Kind.NOT_CONFIGURED,
                    "Language model API key is not configured (set LLM_API_KEY)");
        }
        String model = resolveModel(modelName);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + COMPLETIONS_PATH))
                .timeout(Duration.ofMillis(config.timeoutMs()))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .POST(HttpRequest.BodyPublishers.ofString(buildPayload(prompt, model), StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            log.error("Language model request timed out (model={}, timeout_ms={})", model, config.timeoutMs());
            throw new ProviderException(ProviderException.Kind.TIMEOUT,
                    "Language model request timed out after " + config.timeoutMs() + " ms", e);
        } catch (IOException e) {
            log.error("Language model request failed (model={}): {}", model, e.getMessage());
            throw new ProviderException(ProviderException.Kind.NETWORK,
                    "Error calling language model API: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderException.Kind.NETWORK, "Language model request was interrupted", e);
        }

        if (response.statusCode() >= 400) {
            ProviderException.Kind kind = classifyStatus(response.statusCode());
            log.error("Language model API returned an error (status_code={}, kind={}, model={})",
                    response.statusCode(), kind, model);
            throw new ProviderException(kind,
                    "Language model API error: HTTP " + response.statusCode() + describeError(response.body()));
        }

        String content = extractContent(response.body());
        log.debug("Received completion of {} chars from model {}", content.length(), model);
        return content;
    }

    private String buildPayload(String prompt, String model) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt)
        ));
        payload.put("temperature", TEMPERATURE);
        payload.put("max_tokens", MAX_TOKENS);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize completion request", e);
        }
    }

    private String extractContent(String body) throws ProviderException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderException.Kind.INVALID_RESPONSE,
                    "Language model API returned a non-JSON response", e);
        }
        JsonNode contentNode = root.path("choices").path(0).path("message").path("content");
        if (!contentNode.isTextual()) {
            throw new ProviderException(ProviderException.Kind.INVALID_RESPONSE,
                    "Language model API response has no message content");
        }
        return contentNode.asText();
    }

    private static ProviderException.Kind classifyStatus(int statusCode) {
        if (statusCode == 401 || statusCode == 403) {
            return ProviderException.Kind.AUTHENTICATION;
        }
        if (statusCode == 429) {
            return ProviderException.Kind.RATE_LIMITED;
        }
        return ProviderException.Kind.UPSTREAM;
    }

    /**
     * Pull {@code error.message} out of an OpenAI-style error body when there is one.
     */
    private String describeError(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String detail;
        try {
            JsonNode message = objectMapper.readTree(body).path("error").path("message");
            detail = message.isTextual() ? message.asText() : body;
        } catch (JsonProcessingException e) {
            detail = body;
        }
        if (detail.length() > MAX_ERROR_BODY_CHARS) {
            detail = detail.substring(0, MAX_ERROR_BODY_CHARS);
        }
        return " - " + detail;
    }
}
