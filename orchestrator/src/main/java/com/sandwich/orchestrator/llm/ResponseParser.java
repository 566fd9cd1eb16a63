package com.sandwich.orchestrator.llm;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the JSON payload out of a model response.
 *
 * Models are asked to answer with a fenced ```json block, but sometimes
 * answer with bare JSON or wrap it in prose; all three shapes are handled.
 */
public class ResponseParser {

    // Matches ```json ... ``` or ``` ... ``` (with optional language label)
    private static final Pattern JSON_BLOCK = Pattern.compile(
            "```(?:json)?\\s*\\n(.*?)\\n?```",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /**
     * Extract the JSON text from a response.
     *
     * Order of preference: first fenced block, then the span from the first
     * '{' or '[' to the matching last '}' or ']'. Returns empty if neither exists.
     */
    public static Optional<String> extractJson(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        Matcher m = JSON_BLOCK.matcher(response);
        if (m.find()) {
            return Optional.of(m.group(1).strip());
        }
        int objStart = response.indexOf('{');
        int arrStart = response.indexOf('[');
        int start;
        char close;
        if (arrStart >= 0 && (objStart < 0 || arrStart < objStart)) {
            start = arrStart;
            close = ']';
        } else if (objStart >= 0) {
            start = objStart;
            close = '}';
        } else {
            return Optional.empty();
        }
        int end = response.lastIndexOf(close);
        return end > start ? Optional.of(response.substring(start, end + 1)) : Optional.empty();
    }

    /** First non-blank line of a plain-text answer, without surrounding quotes. */
    public static Optional<String> firstLine(String response) {
        if (response == null) {
            return Optional.empty();
        }
        return response.lines()
                .map(String::strip)
                .filter(l -> !l.isEmpty())
                .findFirst()
                .map(l -> l.replaceAll("^[\"']|[\"']$", ""));
    }
}
