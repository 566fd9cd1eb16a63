package com.sandwich.orchestrator.corpus;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable corpus state captured at one point in time.
 *
 * @param total number of stored sandwiches, including those without an embedding
 */
public record CorpusSnapshot(List<double[]> sandwichEmbeddings,
                             Map<String, Integer> typeCounts,
                             int total) implements CorpusView {

    public CorpusSnapshot {
        sandwichEmbeddings = sandwichEmbeddings == null ? List.of() : List.copyOf(sandwichEmbeddings);
        typeCounts         = typeCounts == null ? Map.of() : Map.copyOf(typeCounts);
    }

    public static CorpusSnapshot empty() {
        return new CorpusSnapshot(List.of(), Map.of(), 0);
    }

    @Override
    public Map<String, Double> structureTypeFrequencies() {
        if (total == 0) {
            return Map.of();
        }
        Map<String, Double> frequencies = new HashMap<>();
        typeCounts.forEach((type, count) -> frequencies.put(type, (double) count / total));
        return frequencies;
    }

    @Override
    public boolean isEmpty() {
        return total == 0;
    }
}
