package com.sandwich.orchestrator.source;

import com.google.common.util.concurrent.RateLimiter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Web search source using the DuckDuckGo HTML endpoint (no API key).
 *
 * A fetch is a search followed by a download of the top hit; the page text
 * is extracted with jsoup after stripping scripts and page chrome.
 * {@link #fetchRandom()} searches for a random seed word.
 */
@Component
@ConditionalOnProperty(prefix = "sandwich.sources.web-search", name = "enabled",
                       havingValue = "true", matchIfMissing = true)
public class WebSearchSource implements ContentSource {

    private static final Logger log = LoggerFactory.getLogger(WebSearchSource.class);

    static final List<String> SEED_WORDS = List.of(
            "theorem", "paradox", "optimization", "constraint", "equilibrium",
            "convergence", "entropy", "symmetry", "recursion", "emergence",
            "bifurcation", "resonance", "topology", "duality", "invariant");

    private final HttpClient  http;
    private final RateLimiter rateLimiter;
    private final SourceProperties.WebSearch config;
    private final String      userAgent;
    private final Duration    timeout;

    public WebSearchSource(SourceProperties properties) {
        this.config      = properties.webSearch();
        this.userAgent   = properties.userAgent();
        this.timeout     = properties.requestTimeout();
        this.rateLimiter = SourceRateLimits.perMinute(config.maxPerMinute());
        this.http        = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override public String name() { return "web_search"; }
    @Override public int    tier() { return config.tier(); }

    @Override
    public SourceResult fetchRandom() {
        String seed = SEED_WORDS.get(ThreadLocalRandom.current().nextInt(SEED_WORDS.size()));
        return fetch(seed);
    }

    @Override
    public SourceResult fetch(String query) {
        if (query == null || query.isBlank()) {
            return fetchRandom();
        }

        String resultsPage = send(HttpRequest.newBuilder()
                .uri(URI.create(config.searchUrl()))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(
                        "q=" + URLEncoder.encode(query, StandardCharsets.UTF_8))),
                "search for '" + query + "'");

        Optional<SearchHit> hit = firstResult(resultsPage, config.searchUrl());
        if (hit.isEmpty()) {
            log.info("Web search returned no usable results for '{}'", query);
            return new SourceResult("", null, null, "html", Map.of("query", query, "error", "no_results"));
        }

        SearchHit top = hit.get();
        String page = send(HttpRequest.newBuilder().uri(URI.create(top.url())).GET(),
                "page " + top.url());
        return new SourceResult(
                extractText(page, config.maxContentChars()),
                top.url(),
                top.title(),
                "html",
                Map.of("query", query, "source", "web_search"));
    }

    // ------------------------------------------------------------------
    // HTML handling (package-private for tests)
    // ------------------------------------------------------------------

    record SearchHit(String url, String title) {}

    /**
     * First organic result on a DuckDuckGo results page.
     *
     * DuckDuckGo wraps targets in a redirect link ({@code /l/?uddg=<target>});
     * the real target is unwrapped so the page fetch goes straight to it.
     */
    static Optional<SearchHit> firstResult(String html, String baseUri) {
        Document doc = Jsoup.parse(html, baseUri);
        Element link = doc.selectFirst("a.result__a");
        if (link == null) {
            return Optional.empty();
        }
        String href = link.absUrl("href");
        if (href.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new SearchHit(unwrapRedirect(href), link.text().strip()));
    }

    static String unwrapRedirect(String href) {
        int idx = href.indexOf("uddg=");
        if (idx < 0) {
            return href;
        }
        String target = href.substring(idx + "uddg=".length());
        int amp = target.indexOf('&');
        if (amp >= 0) target = target.substring(0, amp);
        return URLDecoder.decode(target, StandardCharsets.UTF_8);
    }

    /** Visible text of a page without scripts, styles and navigation, capped at {@code maxChars}. */
    static String extractText(String html, int maxChars) {
        Document doc = Jsoup.parse(html);
        doc.select("script, style, noscript, nav, header, footer, aside").remove();
        String text = doc.body() == null ? "" : doc.body().text().replace('\u00A0', ' ').strip();
        return text.length() > maxChars ? text.substring(0, maxChars) : text;
    }

    private String send(HttpRequest.Builder builder, String opName) {
        SourceRateLimits.acquire(rateLimiter, name());
        try {
            HttpRequest req = builder
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new SourceException("Web " + opName + " failed: HTTP " + resp.statusCode());
            }
            return resp.body();
        } catch (SourceException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceException("Interrupted during web " + opName, e);
        } catch (Exception e) {
            throw new SourceException("Web " + opName + " failed", e);
        }
    }
}
