package com.sandwich.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One sandwich proposal extracted from foraged content.
 *
 * The two bread slices bound the filling from either side; structureType
 * names the kind of bounding (e.g. "bound", "dialectic", "temporal").
 * Produced by the identification step and never mutated afterwards.
 *
 * @param confidence extractor confidence in [0, 1]
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CandidateStructure(
        @JsonProperty("bread_top")      String breadTop,
        @JsonProperty("bread_bottom")   String breadBottom,
        @JsonProperty("filling")        String filling,
        @JsonProperty("structure_type") String structureType,
        @JsonProperty("confidence")     double confidence,
        @JsonProperty("rationale")      String rationale
) {

    public CandidateStructure {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }
        if (structureType == null || structureType.isBlank()) structureType = "unknown";
    }

    /** Text used to embed the candidate as a single concept. */
    public String conceptText() {
        return breadTop + " / " + filling + " / " + breadBottom;
    }
}
