package com.sandwich.orchestrator.embedding;

/**
 * Turns text into a dense vector for novelty and diversity scoring.
 */
public interface EmbeddingService {

    /**
     * @throws com.sandwich.orchestrator.error.PipelineException when the
     *         backing service fails or rejects the request
     */
    double[] embed(String text);
}
