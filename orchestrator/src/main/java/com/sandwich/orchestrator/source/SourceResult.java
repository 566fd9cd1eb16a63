package com.sandwich.orchestrator.source;

import java.util.Map;

/**
 * Raw material returned by a {@link ContentSource}.
 *
 * @param contentType "text" for plain extracts, "html" for scraped pages
 * @param metadata    source-specific extras (query, description, ...)
 */
public record SourceResult(
        String              content,
        String              url,
        String              title,
        String              contentType,
        Map<String, String> metadata
) {

    public SourceResult {
        if (content == null)     content = "";
        if (contentType == null) contentType = "text";
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isEmpty() {
        return content.isBlank();
    }
}
