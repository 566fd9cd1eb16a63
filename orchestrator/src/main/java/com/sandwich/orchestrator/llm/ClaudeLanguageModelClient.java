package com.sandwich.orchestrator.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandwich.orchestrator.error.PipelineException;
import com.sandwich.orchestrator.model.AssembledSandwich;
import com.sandwich.orchestrator.model.CandidateStructure;
import com.sandwich.orchestrator.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link LanguageModelClient} backed by Claude.
 *
 * Each step is a single-turn conversation: a step-specific system prompt
 * from {@link Prompts} and the material as the user message. Structured
 * answers are decoded leniently; anything that cannot be decoded at all
 * becomes a PARSE failure.
 */
@Component
public class ClaudeLanguageModelClient implements LanguageModelClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeLanguageModelClient.class);

    private final ClaudeClient claude;
    private final ObjectMapper json;

    public ClaudeLanguageModelClient(ClaudeClient claude, ObjectMapper objectMapper) {
        this.claude = claude;
        this.json   = objectMapper;
    }

    @Override
    public String generateCuriosity(List<String> recentTopics) {
        String user = recentTopics.isEmpty()
                ? "There are no recent topics yet."
                : "Recent topics:\n- " + String.join("\n- ", recentTopics);
        String reply = ask(Prompts.CURIOSITY, user);
        return ResponseParser.firstLine(reply).orElse("");
    }

    @Override
    public List<CandidateStructure> identifyCandidates(String content) {
        JsonNode root = askForJson(Prompts.IDENTIFY, "CONTENT:\n" + content);
        JsonNode list = root.isArray() ? root : root.path("candidates");
        if (!list.isArray()) {
            throw PipelineException.parse("Identification response has no candidates list", null);
        }

        List<CandidateStructure> candidates = new ArrayList<>();
        for (JsonNode node : list) {
            CandidateStructure candidate = toCandidate(node);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }
        if (candidates.isEmpty() && root.hasNonNull("no_sandwich_reason")) {
            log.info("No sandwich in content: {}", root.get("no_sandwich_reason").asText());
        }
        return candidates;
    }

    @Override
    public AssembledSandwich assemble(CandidateStructure candidate, String content) {
        String user = """
                STRUCTURE:
                bread_top: %s
                filling: %s
                bread_bottom: %s
                structure_type: %s
                rationale: %s

                CONTENT:
                %s""".formatted(candidate.breadTop(), candidate.filling(), candidate.breadBottom(),
                candidate.structureType(), candidate.rationale(), content);

        JsonNode root = askForJson(Prompts.ASSEMBLE, user);
        String name = text(root, "name");
        if (name.isEmpty()) {
            throw PipelineException.parse("Assembly response has no sandwich name", null);
        }
        return new AssembledSandwich(
                name,
                text(root, "description"),
                orElse(text(root, "bread_top"),      candidate.breadTop()),
                orElse(text(root, "filling"),        candidate.filling()),
                orElse(text(root, "bread_bottom"),   candidate.breadBottom()),
                orElse(text(root, "structure_type"), candidate.structureType()));
    }

    @Override
    public ValidationResult validate(AssembledSandwich sandwich, String content) {
        String user = """
                SANDWICH: %s
                %s
                bread_top: %s
                filling: %s
                bread_bottom: %s

                CONTENT:
                %s""".formatted(sandwich.name(), sandwich.description(), sandwich.breadTop(),
                sandwich.filling(), sandwich.breadBottom(), content);

        JsonNode root = askForJson(Prompts.VALIDATE, user);
        double breadCompat = score(root, "bread_compat_score");
        double containment = score(root, "containment_score");
        double specificity = score(root, "specificity_score");
        double overall = root.hasNonNull("overall_score")
                ? score(root, "overall_score")
                : (breadCompat + containment + specificity) / 3.0;
        return new ValidationResult(breadCompat, containment, specificity, overall, text(root, "notes"));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String ask(String system, String user) {
        return claude.complete(system, List.of(new ClaudeClient.Message("user", user)));
    }

    private JsonNode askForJson(String system, String user) {
        String reply = ask(system, user);
        String block = ResponseParser.extractJson(reply)
                .orElseThrow(() -> PipelineException.parse("No JSON found in model response", null));
        try {
            return json.readTree(block);
        } catch (JsonProcessingException e) {
            throw PipelineException.parse("Model response JSON is malformed: " + e.getOriginalMessage(), e);
        }
    }

    /** Null when a bread or the filling is missing; confidence is clamped into [0, 1]. */
    static CandidateStructure toCandidate(JsonNode node) {
        String top     = text(node, "bread_top");
        String bottom  = text(node, "bread_bottom");
        String filling = text(node, "filling");
        if (top.isEmpty() || bottom.isEmpty() || filling.isEmpty()) {
            return null;
        }
        double confidence = Math.max(0.0, Math.min(1.0, node.path("confidence").asDouble(0.5)));
        return new CandidateStructure(top, bottom, filling,
                text(node, "structure_type"), confidence, text(node, "rationale"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText().strip();
    }

    private static String orElse(String value, String fallback) {
        return value.isEmpty() ? fallback : value;
    }

    private static double score(JsonNode node, String field) {
        return Math.max(0.0, Math.min(1.0, node.path(field).asDouble(0.0)));
    }
}
