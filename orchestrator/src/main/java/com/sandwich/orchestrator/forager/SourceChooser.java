package com.sandwich.orchestrator.forager;

import com.sandwich.orchestrator.source.ContentSource;

import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Picks which source of a tier the forager asks next.
 * Tests supply a deterministic chooser; production uses {@link #uniform}.
 */
@FunctionalInterface
public interface SourceChooser {

    /** @param sources non-empty list of the sources in one tier */
    ContentSource choose(List<ContentSource> sources);

    static SourceChooser uniform(RandomGenerator random) {
        return sources -> sources.get(random.nextInt(sources.size()));
    }
}
