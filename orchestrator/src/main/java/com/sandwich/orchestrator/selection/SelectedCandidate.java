package com.sandwich.orchestrator.selection;

import com.sandwich.orchestrator.model.CandidateStructure;

/**
 * The selector's pick, with the terms that produced its score.
 */
public record SelectedCandidate(
        CandidateStructure candidate,
        double             finalScore,
        double             noveltyBonus,
        double             diversityBonus,
        String             rationale
) {}
