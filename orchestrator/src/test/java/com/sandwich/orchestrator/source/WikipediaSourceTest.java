package com.sandwich.orchestrator.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Response parsing only; no HTTP.
 */
class WikipediaSourceTest {

    private final ObjectMapper json = new ObjectMapper();

    @Test
    void firstTitle_readsRandomList() throws Exception {
        JsonNode body = json.readTree("""
                {"batchcomplete":"","query":{"random":[{"id":123,"ns":0,"title":"Squeeze theorem"}]}}
                """);

        assertThat(WikipediaSource.firstTitle(body, "random")).contains("Squeeze theorem");
    }

    @Test
    void firstTitle_emptySearch_isEmpty() throws Exception {
        JsonNode body = json.readTree("""
                {"query":{"searchinfo":{"totalhits":0},"search":[]}}
                """);

        assertThat(WikipediaSource.firstTitle(body, "search")).isEmpty();
    }

    @Test
    void parseSummary_mapsExtractUrlAndMetadata() throws Exception {
        JsonNode body = json.readTree("""
                {
                  "title": "Squeeze theorem",
                  "description": "Method for finding limits in calculus",
                  "extract": "In calculus, the squeeze theorem is a theorem regarding the limit of a function.",
                  "content_urls": {"desktop": {"page": "https://en.wikipedia.org/wiki/Squeeze_theorem"}}
                }
                """);

        SourceResult result = WikipediaSource.parseSummary(body, "limits");

        assertThat(result.title()).isEqualTo("Squeeze theorem");
        assertThat(result.url()).isEqualTo("https://en.wikipedia.org/wiki/Squeeze_theorem");
        assertThat(result.content()).startsWith("In calculus");
        assertThat(result.contentType()).isEqualTo("text");
        assertThat(result.metadata())
                .containsEntry("source", "wikipedia")
                .containsEntry("query", "limits")
                .containsEntry("description", "Method for finding limits in calculus");
    }

    @Test
    void parseSummary_missingExtract_isEmptyResult() throws Exception {
        JsonNode body = json.readTree("""
                {"title": "Nothing here"}
                """);

        SourceResult result = WikipediaSource.parseSummary(body, null);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.url()).isNull();
        assertThat(result.metadata()).doesNotContainKey("query");
    }
}
