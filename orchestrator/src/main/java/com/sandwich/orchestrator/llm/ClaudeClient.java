package com.sandwich.orchestrator.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandwich.orchestrator.error.PipelineException;
import com.sandwich.orchestrator.http.HttpRetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API.
 *
 * Retries 429, 5xx and transport errors through {@link HttpRetryPolicy}; once
 * the retry budget is spent the failure surfaces as a RETRYABLE
 * {@link PipelineException}. Rejected credentials are FATAL straight away.
 */
@Component
public class ClaudeClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** A single message; role is "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Extracts the text from the first text block. */
        public String firstText() {
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> PipelineException.parse("No text block in response", null));
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_URL    = "https://api.anthropic.com/v1/messages";
    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 2048;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       model;
    private final HttpRetryPolicy retryPolicy;

    public ClaudeClient(@Value("${anthropic.api-key}") String apiKey,
                        @Value("${sandwich.llm.model:claude-sonnet-4-5}") String model,
                        @Value("${sandwich.llm.max-retries:3}") int maxRetries,
                        @Value("${sandwich.llm.retry-backoff:2s}") Duration retryBackoff,
                        ObjectMapper objectMapper) {
        this.apiKey       = apiKey;
        this.model        = model;
        this.retryPolicy  = new HttpRetryPolicy("Claude API", maxRetries, retryBackoff);
        this.json         = objectMapper;
        this.http         = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Send a conversation to Claude and return the assistant's text reply.
     *
     * @param system   system prompt
     * @param messages conversation so far (user + assistant turns)
     * @throws PipelineException FATAL on 401/403, RETRYABLE after the retry
     *                           budget, OTHER on any other 4xx
     */
    public String complete(String system, List<Message> messages) {
        String requestBody;
        try {
            requestBody = json.writeValueAsString(Map.of(
                    "model",      model,
                    "max_tokens", MAX_TOKENS,
                    "system",     system,
                    "messages",   messages));
        } catch (IOException e) {
            throw new IllegalArgumentException("Could not serialise Claude request", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(API_URL))
                .timeout(Duration.ofSeconds(60))
                .header("content-type",      "application/json")
                .header("x-api-key",         apiKey)
                .header("anthropic-version", API_VER)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        HttpRetryPolicy.Result result = retryPolicy.execute(
                () -> http.send(request, HttpResponse.BodyHandlers.ofString()));
        if (result.status() != 200) {
            throw failureFor(result.status(), result.body(), result.attempts());
        }
        if (result.attempts() > 1) {
            log.info("Claude API answered on attempt {}", result.attempts());
        }
        try {
            return json.readValue(result.body(), MessagesResponse.class).firstText();
        } catch (JsonProcessingException e) {
            throw PipelineException.parse("Claude response is not valid JSON", e);
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    /** Map a non-200 status onto the pipeline error taxonomy. */
    static PipelineException failureFor(int status, String body, int attempts) {
        String message = "Claude API error %d: %s".formatted(status, body);
        if (status == 401 || status == 403) {
            return PipelineException.fatal("auth_error", message, null);
        }
        if (status == 429) {
            return PipelineException.retriesExhausted("rate_limit", message, attempts, null);
        }
        if (status >= 500) {
            return PipelineException.retriesExhausted("server_error", message, attempts, null);
        }
        return new PipelineException(PipelineException.Kind.OTHER, "invalid_request", message);
    }
}
