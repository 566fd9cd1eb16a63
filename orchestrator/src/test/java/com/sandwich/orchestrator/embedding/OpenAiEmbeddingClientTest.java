package com.sandwich.orchestrator.embedding;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandwich.orchestrator.error.PipelineException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Response decoding and status mapping; no HTTP.
 */
class OpenAiEmbeddingClientTest {

    private final ObjectMapper json = new ObjectMapper();

    @Test
    void parse_readsFirstEmbedding() {
        String body = """
                {"object": "list",
                 "data": [{"object": "embedding", "index": 0, "embedding": [0.1, -0.2, 0.3]}],
                 "model": "text-embedding-3-small",
                 "usage": {"prompt_tokens": 5, "total_tokens": 5}}
                """;

        assertThat(OpenAiEmbeddingClient.parse(json, body)).containsExactly(0.1, -0.2, 0.3);
    }

    @Test
    void parse_emptyData_isParseFailure() {
        assertThatThrownBy(() -> OpenAiEmbeddingClient.parse(json, "{\"data\": []}"))
                .isInstanceOfSatisfying(PipelineException.class,
                        e -> assertThat(e.getKind()).isEqualTo(PipelineException.Kind.PARSE));
    }

    @Test
    void parse_notJson_isParseFailure() {
        assertThatThrownBy(() -> OpenAiEmbeddingClient.parse(json, "<html>502 Bad Gateway</html>"))
                .isInstanceOf(PipelineException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    void failureFor_rejectedCredentialsAreFatal() {
        PipelineException e = OpenAiEmbeddingClient.failureFor(401, "invalid key", 1);

        assertThat(e.getKind()).isEqualTo(PipelineException.Kind.FATAL);
        assertThat(e.getReason()).isEqualTo("auth_error");
    }

    @Test
    void failureFor_serverErrorAfterRetries_carriesAttemptCount() {
        PipelineException e = OpenAiEmbeddingClient.failureFor(503, "overloaded", 4);

        assertThat(e.getKind()).isEqualTo(PipelineException.Kind.RETRYABLE);
        assertThat(e.getReason()).isEqualTo("embedding_error");
        assertThat(e.getAttempts()).isEqualTo(4);
    }

    @Test
    void failureFor_badRequest_isNotRetryable() {
        PipelineException e = OpenAiEmbeddingClient.failureFor(400, "input too long", 1);

        assertThat(e.getKind()).isEqualTo(PipelineException.Kind.OTHER);
        assertThat(e.getReason()).isEqualTo("invalid_request");
    }
}
