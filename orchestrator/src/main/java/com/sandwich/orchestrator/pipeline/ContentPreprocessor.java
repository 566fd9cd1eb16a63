package com.sandwich.orchestrator.pipeline;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normalises foraged text before identification.
 *
 * Collapses runs of spaces and tabs, squeezes blank lines to one, drops
 * content shorter than {@code minContentLength} and truncates to
 * {@code maxContentLength}.
 */
@Component
public class ContentPreprocessor {

    private static final Pattern INLINE_SPACE = Pattern.compile("[ \\t\\x0B\\f\\u00A0]+");
    private static final Pattern BLANK_LINES  = Pattern.compile("\\n\\s*\\n(\\s*\\n)*");

    private final PipelineProperties config;

    public ContentPreprocessor(PipelineProperties config) {
        this.config = config;
    }

    /** Normalised content, or empty if what is left is too short to be worth a look. */
    public Optional<String> prepare(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String text = raw.replace("\r\n", "\n").replace('\r', '\n');
        text = INLINE_SPACE.matcher(text).replaceAll(" ");
        text = BLANK_LINES.matcher(text).replaceAll("\n\n");
        text = text.strip();

        if (text.length() < config.minContentLength()) {
            return Optional.empty();
        }
        if (text.length() > config.maxContentLength()) {
            text = text.substring(0, config.maxContentLength());
        }
        return Optional.of(text);
    }
}
