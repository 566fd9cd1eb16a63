package com.sandwich.orchestrator.corpus;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of the sandwiches made so far, as the selection step needs it.
 */
public interface CorpusView {

    /** Embeddings of stored sandwiches that have one, oldest first. */
    List<double[]> sandwichEmbeddings();

    /** Share of stored sandwiches per structure type, each in [0, 1]; empty when nothing is stored. */
    Map<String, Double> structureTypeFrequencies();

    boolean isEmpty();
}
