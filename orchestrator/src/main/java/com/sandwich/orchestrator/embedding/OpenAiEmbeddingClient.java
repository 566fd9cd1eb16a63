package com.sandwich.orchestrator.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandwich.orchestrator.error.PipelineException;
import com.sandwich.orchestrator.http.HttpRetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the OpenAI embeddings endpoint.
 *
 * 429, 5xx and transport errors are retried through {@link HttpRetryPolicy};
 * once the budget is spent the failure surfaces as RETRYABLE so the session
 * recovers and moves on to the next foraging round.
 */
@Component
public class OpenAiEmbeddingClient implements EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingClient.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingResponse(List<Item> data) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Item(double[] embedding) {}
    }

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       apiUrl;
    private final String       model;
    private final HttpRetryPolicy retryPolicy;

    public OpenAiEmbeddingClient(
            @Value("${openai.api-key}") String apiKey,
            @Value("${sandwich.embedding.api-url:https://api.openai.com/v1/embeddings}") String apiUrl,
            @Value("${sandwich.embedding.model:text-embedding-3-small}") String model,
            @Value("${sandwich.embedding.max-retries:3}") int maxRetries,
            @Value("${sandwich.embedding.retry-backoff:1s}") Duration retryBackoff,
            ObjectMapper objectMapper) {
        this.apiKey = apiKey;
        this.apiUrl = apiUrl;
        this.model  = model;
        this.retryPolicy = new HttpRetryPolicy("Embedding API", maxRetries, retryBackoff);
        this.json   = objectMapper;
        this.http   = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public double[] embed(String text) {
        String body;
        try {
            body = json.writeValueAsString(Map.of("model", model, "input", text));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialise embedding request", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl))
                .timeout(Duration.ofSeconds(30))
                .header("Content-Type",  "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpRetryPolicy.Result result = retryPolicy.execute(
                () -> http.send(request, HttpResponse.BodyHandlers.ofString()));
        if (result.status() < 200 || result.status() >= 300) {
            throw failureFor(result.status(), result.body(), result.attempts());
        }
        if (result.attempts() > 1) {
            log.info("Embedding API answered on attempt {}", result.attempts());
        }
        return parse(json, result.body());
    }

    /** Map a non-2xx status onto the pipeline error taxonomy. */
    static PipelineException failureFor(int status, String body, int attempts) {
        String message = "Embedding API error " + status + ": " + body;
        if (status == 401 || status == 403) {
            return PipelineException.fatal("auth_error", message, null);
        }
        if (HttpRetryPolicy.isRetryable(status)) {
            return PipelineException.retriesExhausted("embedding_error", message, attempts, null);
        }
        return new PipelineException(PipelineException.Kind.OTHER, "invalid_request", message);
    }

    /** First embedding vector in an embeddings API response body. */
    static double[] parse(ObjectMapper json, String body) {
        try {
            EmbeddingResponse response = json.readValue(body, EmbeddingResponse.class);
            if (response.data() == null || response.data().isEmpty() || response.data().get(0).embedding() == null) {
                throw PipelineException.parse("Embedding response has no data", null);
            }
            return response.data().get(0).embedding();
        } catch (JsonProcessingException e) {
            throw PipelineException.parse("Embedding response is not valid JSON", e);
        }
    }
}
