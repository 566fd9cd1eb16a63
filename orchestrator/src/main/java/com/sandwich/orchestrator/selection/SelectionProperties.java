package com.sandwich.orchestrator.selection;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Candidate scoring weights, bound from {@code sandwich.selection.*}.
 *
 * final_score = confidence + noveltyWeight * novelty + diversityWeight * diversity
 */
@ConfigurationProperties(prefix = "sandwich.selection")
public record SelectionProperties(
        Double minConfidence,
        Double noveltyWeight,
        Double diversityWeight
) {

    public SelectionProperties {
        if (minConfidence == null)   minConfidence = 0.4;
        if (noveltyWeight == null)   noveltyWeight = 0.3;
        if (diversityWeight == null) diversityWeight = 0.2;
    }

    public static SelectionProperties defaults() {
        return new SelectionProperties(null, null, null);
    }
}
