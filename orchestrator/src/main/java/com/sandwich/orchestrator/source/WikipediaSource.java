package com.sandwich.orchestrator.source;

import com.google.common.util.concurrent.RateLimiter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Encyclopedia source backed by the public Wikipedia APIs.
 *
 * Two requests per fetch:
 *   1. MediaWiki action API - a random title, or the best search hit for a query
 *   2. REST summary endpoint - the lead extract of that page
 *
 * No API key; requests are spaced by the source's own Guava {@link RateLimiter}.
 */
@Component
@ConditionalOnProperty(prefix = "sandwich.sources.wikipedia", name = "enabled",
                       havingValue = "true", matchIfMissing = true)
public class WikipediaSource implements ContentSource {

    private static final Logger log = LoggerFactory.getLogger(WikipediaSource.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final RateLimiter  rateLimiter;
    private final SourceProperties.Wikipedia config;
    private final String       userAgent;
    private final Duration     timeout;

    public WikipediaSource(SourceProperties properties, ObjectMapper objectMapper) {
        this.config      = properties.wikipedia();
        this.json        = objectMapper;
        this.userAgent   = properties.userAgent();
        this.timeout     = properties.requestTimeout();
        this.rateLimiter = SourceRateLimits.perMinute(config.maxPerMinute());
        this.http        = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override public String name() { return "wikipedia"; }
    @Override public int    tier() { return config.tier(); }

    @Override
    public SourceResult fetchRandom() {
        JsonNode body = getJson(config.apiUrl()
                + "?action=query&list=random&rnnamespace=0&rnlimit=1&format=json");
        return firstTitle(body, "random")
                .map(title -> summary(title, null))
                .orElseGet(() -> emptyResult(null, "no_random_page"));
    }

    @Override
    public SourceResult fetch(String query) {
        if (query == null || query.isBlank()) {
            return fetchRandom();
        }
        JsonNode body = getJson(config.apiUrl()
                + "?action=query&list=search&srlimit=1&format=json&srsearch=" + encode(query));
        return firstTitle(body, "search")
                .map(title -> summary(title, query))
                .orElseGet(() -> emptyResult(query, "no_results"));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private SourceResult summary(String title, String query) {
        JsonNode body = getJson(config.summaryUrl() + encode(title.replace(' ', '_')));
        return parseSummary(body, query);
    }

    /** First {@code title} of {@code query.<listName>[]} in an action-API response. */
    static Optional<String> firstTitle(JsonNode body, String listName) {
        JsonNode first = body.path("query").path(listName).path(0);
        String title = first.path("title").asText("");
        return title.isBlank() ? Optional.empty() : Optional.of(title);
    }

    /** Turn a REST page-summary response into a {@link SourceResult}. */
    static SourceResult parseSummary(JsonNode body, String query) {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("source", "wikipedia");
        String description = body.path("description").asText("");
        if (!description.isBlank()) metadata.put("description", description);
        if (query != null)          metadata.put("query", query);

        String url = body.path("content_urls").path("desktop").path("page").asText(null);
        return new SourceResult(
                body.path("extract").asText(""),
                url,
                body.path("title").asText(null),
                "text",
                metadata);
    }

    private SourceResult emptyResult(String query, String error) {
        log.info("Wikipedia returned nothing for query '{}' ({})", query, error);
        Map<String, String> metadata = new HashMap<>();
        metadata.put("error", error);
        if (query != null) metadata.put("query", query);
        return new SourceResult("", null, null, "text", metadata);
    }

    private JsonNode getJson(String url) {
        SourceRateLimits.acquire(rateLimiter, name());
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .header("Accept",     "application/json")
                    .header("User-Agent", userAgent)
                    .GET()
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new SourceException("Wikipedia request failed - HTTP " + resp.statusCode() + ": " + url);
            }
            return json.readTree(resp.body());
        } catch (SourceException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceException("Interrupted during Wikipedia request " + url, e);
        } catch (Exception e) {
            throw new SourceException("Wikipedia request failed: " + url, e);
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
