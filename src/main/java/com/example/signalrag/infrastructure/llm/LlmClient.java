package com.example.signalrag.infrastructure.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

/**
 * Client for an OpenAI-compatible {@code /v1/chat/completions} endpoint.
 */
@Service
public class LlmClient {

    private static final Logger log = LoggerFactory.getLogger(LlmClient.class);

    private static final String SYSTEM_PROMPT =
            "You are a helpful assistant that answers questions using only the provided documents.";

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final Duration readTimeout;

    public LlmClient(
            ObjectMapper objectMapper,
            @Value("${signalrag.llm.base-url}") String baseUrl,
            @Value("${signalrag.llm.api-key:}") String apiKey,
            @Value("${signalrag.llm.model}") String model,
            @Value("${signalrag.llm.temperature:0.1}") double temperature,
            @Value("${signalrag.llm.max-tokens:500}") int maxTokens,
            @Value("${signalrag.llm.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${signalrag.llm.read-timeout-ms:60000}") int readTimeoutMs
    ) {
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.readTimeout = Duration.ofMillis(readTimeoutMs);

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        log.info("event=llm_client_config baseUrl={} model={} temp={} maxTokens={} connectTimeoutMs={} readTimeoutMs={}",
                baseUrl, model, temperature, maxTokens, connectTimeoutMs, readTimeoutMs);
        if (this.apiKey.isBlank()) {
            log.warn("event=llm_not_configured msg=\"signalrag.llm.api-key is empty, answers will report status=error\"");
        }
    }

    public String model() {
        return model;
    }

    public boolean configured() {
        return !apiKey.isBlank();
    }

    @Retryable(
            retryFor = {RuntimeException.class},
            noRetryFor = {LlmNotConfiguredException.class},
            maxAttemptsExpression = "#{${signalrag.llm.retries:2} + 1}",
            backoff = @Backoff(delay = 200, multiplier = 2.0)
    )
    public String complete(String prompt) {
        if (!configured()) {
            throw new LlmNotConfiguredException("signalrag.llm.api-key is required for answer generation");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("temperature", temperature);
        payload.put("max_tokens", maxTokens);
        payload.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt)
        ));

        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize chat request", e);
        }

        URI uri = URI.create(baseUrl.endsWith("/") ? baseUrl + "v1/chat/completions" : baseUrl + "/v1/chat/completions");
        HttpRequest req = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(readTimeout)
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        long t0 = System.nanoTime();
        HttpResponse<String> resp;
        try {
            resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Chat request interrupted", e);
        } catch (Exception e) {
            throw new IllegalStateException("Chat request failed", e);
        }
        long ms = (System.nanoTime() - t0) / 1_000_000;

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            log.warn("event=llm_http_error status={} ms={} body_snip={}", resp.statusCode(), ms, snippet(resp.body()));
            throw new IllegalStateException("Chat HTTP error: " + resp.statusCode());
        }

        String answer = extractContent(resp.body());
        log.info("event=llm_ok ms={} chars_out={}", ms, answer.length());
        return answer;
    }

    String extractContent(String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to parse chat response", e);
        }
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new IllegalStateException("Chat response missing choices");
        }
        JsonNode content = choices.get(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw new IllegalStateException("Chat response missing message content");
        }
        return content.asText().trim();
    }

    private static String snippet(String s) {
        if (s == null) return "";
        String t = s.replaceAll("\\s+", " ").trim();
        return t.length() <= 200 ? t : t.substring(0, 200) + "...";
    }
}
