package com.sandwich.orchestrator.selection;

import com.sandwich.orchestrator.model.CandidateStructure;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CandidateSelectorTest {

    private final CandidateSelector selector = new CandidateSelector(SelectionProperties.defaults());

    @Test
    void emptyContext_picksHighestConfidence() {
        List<CandidateStructure> candidates = List.of(
                candidate("bound", 0.6), candidate("temporal", 0.9), candidate("dialectic", 0.7));

        Optional<SelectedCandidate> selected = selector.select(candidates, SelectionContext.empty());

        assertThat(selected).isPresent();
        assertThat(selected.get().candidate().confidence()).isEqualTo(0.9);
        assertThat(selected.get().noveltyBonus()).isEqualTo(1.0);
        assertThat(selected.get().diversityBonus()).isEqualTo(1.0);
        assertThat(selected.get().finalScore()).isCloseTo(1.4, within(1e-9));
    }

    @Test
    void rationale_listsEveryTerm() {
        SelectedCandidate selected = selector.select(
                List.of(candidate("bound", 0.9)), SelectionContext.empty()).orElseThrow();

        assertThat(selected.rationale()).isEqualTo(
                "confidence=0.90, novelty_bonus=1.00 (w=0.3), diversity_bonus=1.00 (w=0.2), final=1.400");
    }

    @Test
    void allBelowMinConfidence_selectsNothing() {
        List<CandidateStructure> candidates = List.of(candidate("bound", 0.1), candidate("temporal", 0.39));

        assertThat(selector.select(candidates, SelectionContext.empty())).isEmpty();
    }

    @Test
    void emptyCandidateList_selectsNothing() {
        assertThat(selector.select(List.of(), SelectionContext.empty())).isEmpty();
    }

    @Test
    void lowConfidenceCandidates_areSkippedNotPenalised() {
        List<CandidateStructure> candidates = List.of(candidate("bound", 0.2), candidate("temporal", 0.5));

        assertThat(selector.select(candidates, SelectionContext.empty()))
                .get().extracting(s -> s.candidate().structureType()).isEqualTo("temporal");
    }

    @Test
    void novelty_favoursCandidateUnlikeTheCorpus() {
        CandidateStructure familiar = candidate("bound", 0.8);
        CandidateStructure fresh    = candidate("bound", 0.7);
        SelectionContext context = new SelectionContext(
                List.of(new double[]{1.0, 0.0}),
                List.of(new double[]{1.0, 0.0}, new double[]{0.0, 1.0}),
                Map.of());

        SelectedCandidate selected = selector.select(List.of(familiar, fresh), context).orElseThrow();

        assertThat(selected.candidate()).isSameAs(fresh);
        assertThat(selected.noveltyBonus()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void diversity_favoursRareStructureType() {
        CandidateStructure common = candidate("bound", 0.8);
        CandidateStructure rare   = candidate("temporal", 0.75);
        SelectionContext context = new SelectionContext(List.of(), List.of(), Map.of("bound", 0.9));

        SelectedCandidate selected = selector.select(List.of(common, rare), context).orElseThrow();

        assertThat(selected.candidate()).isSameAs(rare);
        assertThat(selected.diversityBonus()).isEqualTo(1.0);
    }

    @Test
    void tie_keepsFirstCandidate() {
        CandidateStructure first  = candidate("bound", 0.8);
        CandidateStructure second = candidate("bound", 0.8);

        SelectedCandidate selected = selector.select(List.of(first, second), SelectionContext.empty()).orElseThrow();

        assertThat(selected.candidate()).isSameAs(first);
    }

    @Test
    void missingCandidateEmbedding_countsAsNovel() {
        SelectionContext context = new SelectionContext(
                List.of(new double[]{1.0, 0.0}), List.of(), Map.of());

        SelectedCandidate selected = selector.select(List.of(candidate("bound", 0.6)), context).orElseThrow();

        assertThat(selected.noveltyBonus()).isEqualTo(1.0);
    }

    @Test
    void explicitConfig_overridesDefaults() {
        SelectionProperties strict = new SelectionProperties(0.95, 0.0, 0.0);

        assertThat(selector.select(List.of(candidate("bound", 0.9)), SelectionContext.empty(), strict)).isEmpty();
    }

    private static CandidateStructure candidate(String type, double confidence) {
        return new CandidateStructure("upper", "lower", "middle", type, confidence, "because");
    }
}
