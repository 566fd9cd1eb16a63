package com.sandwich.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named sandwich written up from a selected candidate by the assembly step.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AssembledSandwich(
        @JsonProperty("name")           String name,
        @JsonProperty("description")    String description,
        @JsonProperty("bread_top")      String breadTop,
        @JsonProperty("filling")        String filling,
        @JsonProperty("bread_bottom")   String breadBottom,
        @JsonProperty("structure_type") String structureType
) {

    /** Text used to embed the finished sandwich into the corpus. */
    public String embeddingText() {
        return name + ": " + breadTop + " / " + filling + " / " + breadBottom;
    }
}
