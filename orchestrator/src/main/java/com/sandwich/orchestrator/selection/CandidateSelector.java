package com.sandwich.orchestrator.selection;

import com.sandwich.orchestrator.model.CandidateStructure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks the best sandwich candidate from one identification round.
 *
 * Score per candidate:
 * <pre>
 *   final = confidence + noveltyWeight * novelty + diversityWeight * diversity
 *   novelty   = 1 - max cosine(candidate, any stored sandwich)   (1.0 without corpus data)
 *   diversity = 1 - share of the candidate's structure type      (1.0 for unseen types)
 * </pre>
 * Candidates below {@code minConfidence} are dropped first. The highest
 * score wins; on a tie the earlier candidate is kept.
 *
 * Stateless apart from its default configuration.
 */
@Component
public class CandidateSelector {

    private static final Logger log = LoggerFactory.getLogger(CandidateSelector.class);

    private final SelectionProperties defaults;

    public CandidateSelector(SelectionProperties defaults) {
        this.defaults = defaults;
    }

    public Optional<SelectedCandidate> select(List<CandidateStructure> candidates, SelectionContext context) {
        return select(candidates, context, defaults);
    }

    public Optional<SelectedCandidate> select(List<CandidateStructure> candidates,
                                              SelectionContext context,
                                              SelectionProperties cfg) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        SelectedCandidate best = null;
        int viable = 0;

        // Index into the original list: candidate embeddings are parallel to it.
        for (int i = 0; i < candidates.size(); i++) {
            CandidateStructure cand = candidates.get(i);
            if (cand.confidence() < cfg.minConfidence()) {
                continue;
            }
            viable++;

            double novelty   = noveltyBonus(i, context);
            double diversity = diversityBonus(cand, context);
            double finalScore = cand.confidence()
                    + cfg.noveltyWeight() * novelty
                    + cfg.diversityWeight() * diversity;

            String rationale = String.format(Locale.ROOT,
                    "confidence=%.2f, novelty_bonus=%.2f (w=%s), diversity_bonus=%.2f (w=%s), final=%.3f",
                    cand.confidence(), novelty, cfg.noveltyWeight(), diversity, cfg.diversityWeight(), finalScore);
            log.debug("Candidate '{}' / '{}': {}", abbreviate(cand.breadTop()), abbreviate(cand.filling()), rationale);

            if (best == null || finalScore > best.finalScore()) {
                best = new SelectedCandidate(cand, finalScore, novelty, diversity, rationale);
            }
        }

        if (viable == 0) {
            log.info("All {} candidates below min_confidence={}", candidates.size(), cfg.minConfidence());
            return Optional.empty();
        }

        log.info("Selected candidate: type={}, {}", best.candidate().structureType(), best.rationale());
        return Optional.of(best);
    }

    // ------------------------------------------------------------------
    // Bonuses
    // ------------------------------------------------------------------

    private static double noveltyBonus(int index, SelectionContext context) {
        if (context.corpusEmbeddings().isEmpty() || index >= context.candidateEmbeddings().size()) {
            return 1.0;
        }
        double[] embedding = context.candidateEmbeddings().get(index);
        if (embedding == null) {
            return 1.0;
        }
        double maxSimilarity = context.corpusEmbeddings().stream()
                .mapToDouble(stored -> Vectors.cosineSimilarity(embedding, stored))
                .max()
                .orElse(0.0);
        return Vectors.clamp01(1.0 - maxSimilarity);
    }

    private static double diversityBonus(CandidateStructure cand, SelectionContext context) {
        Double frequency = context.typeFrequencies().get(cand.structureType());
        return frequency == null ? 1.0 : Vectors.clamp01(1.0 - frequency);
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= 30 ? s : s.substring(0, 30);
    }
}
