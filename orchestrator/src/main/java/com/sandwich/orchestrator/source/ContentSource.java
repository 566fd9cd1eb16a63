package com.sandwich.orchestrator.source;

/**
 * An information source the forager can explore.
 *
 * Tier 1 sources are the most reliable; higher tiers are more experimental.
 * Implementations are shared across sessions and must be thread-safe.
 * Either fetch method may throw any {@link RuntimeException}; callers treat
 * that as a failed fetch, not as a crash.
 */
public interface ContentSource {

    String name();

    int tier();

    /** Fetch content matching {@code query}. */
    SourceResult fetch(String query);

    /** Fetch something arbitrary, for serendipitous discovery. */
    SourceResult fetchRandom();
}
