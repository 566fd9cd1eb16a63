package com.sandwich.orchestrator.source;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * HTML handling only; no HTTP.
 */
class WebSearchSourceTest {

    private static final String RESULTS_PAGE = """
            <html><body>
              <div class="result">
                <h2><a class="result__a" href="//duckduckgo.com/l/?uddg=https%3A%2F%2Fexample.org%2Fsandwich%3Fa%3D1&amp;rut=abc">
                  The Sandwich Theorem</a></h2>
              </div>
              <div class="result">
                <h2><a class="result__a" href="https://second.example.org/">Second</a></h2>
              </div>
            </body></html>
            """;

    @Test
    void firstResult_unwrapsRedirectLink() {
        Optional<WebSearchSource.SearchHit> hit =
                WebSearchSource.firstResult(RESULTS_PAGE, "https://html.duckduckgo.com/html/");

        assertThat(hit).isPresent();
        assertThat(hit.get().url()).isEqualTo("https://example.org/sandwich?a=1");
        assertThat(hit.get().title()).isEqualTo("The Sandwich Theorem");
    }

    @Test
    void firstResult_noResults_isEmpty() {
        assertThat(WebSearchSource.firstResult("<html><body><p>No results.</p></body></html>",
                "https://html.duckduckgo.com/html/")).isEmpty();
    }

    @Test
    void unwrapRedirect_plainLinkIsUnchanged() {
        assertThat(WebSearchSource.unwrapRedirect("https://example.org/page"))
                .isEqualTo("https://example.org/page");
    }

    @Test
    void extractText_dropsScriptsAndPageChrome() {
        String html = """
                <html><head><style>p { color: red; }</style></head><body>
                  <header>Site header</header>
                  <nav>Home | About</nav>
                  <script>var tracking = true;</script>
                  <article><p>The filling sits between two slices.</p></article>
                  <footer>Copyright</footer>
                </body></html>
                """;

        String text = WebSearchSource.extractText(html, 10_000);

        assertThat(text).isEqualTo("The filling sits between two slices.");
    }

    @Test
    void extractText_capsLength() {
        String html = "<html><body><p>" + "a".repeat(500) + "</p></body></html>";

        assertThat(WebSearchSource.extractText(html, 100)).hasSize(100);
    }

    @Test
    void seedWords_areAvailableForRandomFetches() {
        assertThat(WebSearchSource.SEED_WORDS).isNotEmpty().doesNotHaveDuplicates();
    }
}
