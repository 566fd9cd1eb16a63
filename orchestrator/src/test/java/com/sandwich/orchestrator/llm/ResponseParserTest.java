package com.sandwich.orchestrator.llm;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseParserTest {

    // ------------------------------------------------------------------
    // extractJson
    // ------------------------------------------------------------------

    @Test
    void extractJson_fencedBlock() {
        String response = """
                Here is what I found.

                ```json
                {"candidates": []}
                ```
                Hope that helps.""";

        assertThat(ResponseParser.extractJson(response)).contains("{\"candidates\": []}");
    }

    @Test
    void extractJson_unlabelledFence() {
        String response = "```\n{\"name\": \"The Squeeze\"}\n```";

        assertThat(ResponseParser.extractJson(response)).contains("{\"name\": \"The Squeeze\"}");
    }

    @Test
    void extractJson_bareObjectInProse() {
        String response = "Sure! {\"overall_score\": 0.8, \"notes\": \"tight\"} That's my verdict.";

        assertThat(ResponseParser.extractJson(response))
                .contains("{\"overall_score\": 0.8, \"notes\": \"tight\"}");
    }

    @Test
    void extractJson_bareArrayBeforeObject() {
        String response = "[{\"bread_top\": \"a\"}]";

        assertThat(ResponseParser.extractJson(response)).contains("[{\"bread_top\": \"a\"}]");
    }

    @Test
    void extractJson_noJson_isEmpty() {
        assertThat(ResponseParser.extractJson("I make sandwiches, not word salad.")).isEmpty();
        assertThat(ResponseParser.extractJson("")).isEmpty();
        assertThat(ResponseParser.extractJson(null)).isEmpty();
    }

    // ------------------------------------------------------------------
    // firstLine
    // ------------------------------------------------------------------

    @Test
    void firstLine_skipsBlankLinesAndQuotes() {
        assertThat(ResponseParser.firstLine("\n\n  \"boundary layer physics\"  \nmore text"))
                .contains("boundary layer physics");
    }

    @Test
    void firstLine_blankResponse_isEmpty() {
        assertThat(ResponseParser.firstLine("   \n  ")).isEmpty();
    }
}
