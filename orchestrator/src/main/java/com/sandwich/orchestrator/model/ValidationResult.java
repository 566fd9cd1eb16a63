package com.sandwich.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Scores returned by the validation step for an assembled sandwich.
 *
 * overallScore drives the accepted / review / rejected decision; the
 * individual scores are kept for the stored record.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidationResult(
        @JsonProperty("bread_compat_score")  double breadCompatScore,
        @JsonProperty("containment_score")   double containmentScore,
        @JsonProperty("specificity_score")   double specificityScore,
        @JsonProperty("overall_score")       double overallScore,
        @JsonProperty("notes")               String notes
) {}
