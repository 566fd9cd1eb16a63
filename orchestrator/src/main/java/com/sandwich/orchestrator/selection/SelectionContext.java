package com.sandwich.orchestrator.selection;

import java.util.List;
import java.util.Map;

/**
 * What the selector knows about the existing corpus.
 *
 * @param corpusEmbeddings    embeddings of stored sandwiches; empty means every candidate is novel
 * @param candidateEmbeddings one embedding per candidate, same order as the candidate list
 * @param typeFrequencies     structure type → share of the corpus in [0, 1]
 */
public record SelectionContext(
        List<double[]>      corpusEmbeddings,
        List<double[]>      candidateEmbeddings,
        Map<String, Double> typeFrequencies
) {

    public SelectionContext {
        corpusEmbeddings    = corpusEmbeddings == null ? List.of() : List.copyOf(corpusEmbeddings);
        candidateEmbeddings = candidateEmbeddings == null ? List.of() : List.copyOf(candidateEmbeddings);
        typeFrequencies     = typeFrequencies == null ? Map.of() : Map.copyOf(typeFrequencies);
    }

    /** No corpus information: novelty and diversity bonuses are both 1.0. */
    public static SelectionContext empty() {
        return new SelectionContext(null, null, null);
    }
}
