package com.sandwich.orchestrator.source;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Content source settings, bound from {@code sandwich.sources.*}.
 *
 * Example:
 * <pre>
 *   sandwich.sources.wikipedia.enabled=true
 *   sandwich.sources.web-search.max-per-minute=10
 * </pre>
 */
@ConfigurationProperties(prefix = "sandwich.sources")
public record SourceProperties(
        String     userAgent,
        Duration   requestTimeout,
        Wikipedia  wikipedia,
        WebSearch  webSearch
) {

    // Compact constructor: fill in defaults for anything left out of application.yml.
    public SourceProperties {
        if (userAgent == null || userAgent.isBlank())
            userAgent = "Mozilla/5.0 (compatible; SANDWICH-Bot/1.0; research project)";
        if (requestTimeout == null) requestTimeout = Duration.ofSeconds(30);
        if (wikipedia == null)      wikipedia = new Wikipedia(true, 1, 60, null, null);
        if (webSearch == null)      webSearch = new WebSearch(true, 2, 10, null, 0);
    }

    public record Wikipedia(boolean enabled, int tier, int maxPerMinute,
                            String apiUrl, String summaryUrl) {
        public Wikipedia {
            if (tier <= 0)         tier = 1;
            if (maxPerMinute <= 0) maxPerMinute = 60;
            if (apiUrl == null)     apiUrl = "https://en.wikipedia.org/w/api.php";
            if (summaryUrl == null) summaryUrl = "https://en.wikipedia.org/api/rest_v1/page/summary/";
        }
    }

    public record WebSearch(boolean enabled, int tier, int maxPerMinute,
                            String searchUrl, int maxContentChars) {
        public WebSearch {
            if (tier <= 0)            tier = 2;
            if (maxPerMinute <= 0)    maxPerMinute = 10;
            if (searchUrl == null)    searchUrl = "https://html.duckduckgo.com/html/";
            if (maxContentChars <= 0) maxContentChars = 10_000;
        }
    }
}
