package com.sandwich.orchestrator.forager;

import com.sandwich.orchestrator.error.ConfigurationException;
import com.sandwich.orchestrator.llm.LanguageModelClient;
import com.sandwich.orchestrator.observe.PipelineObserver;
import com.sandwich.orchestrator.source.ContentSource;
import com.sandwich.orchestrator.source.SourceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Explores content sources organised in tiers (1 = most reliable).
 *
 * The forager starts at tier 1 and moves one tier up after
 * {@code successesToPromote} consecutive successes, one tier down after
 * {@code failuresToDemote} consecutive failures. Needing a streak rather than
 * a single outcome keeps one unlucky fetch from flipping tiers.
 *
 * One instance per session: tier and streak counters are never shared
 * between sessions. The counters and tier resolution are guarded by the
 * instance monitor; the network fetch itself runs outside it.
 */
public class Forager {

    private static final Logger log = LoggerFactory.getLogger(Forager.class);

    private final Map<Integer, List<ContentSource>> sources;
    private final LanguageModelClient llm;
    private final ForagerProperties   config;
    private final SourceChooser       chooser;
    private final PipelineObserver    observer;
    private final int                 maxTier;

    private int currentTier = 1;
    private int consecutiveSuccesses = 0;
    private int consecutiveFailures = 0;

    public Forager(Map<Integer, List<ContentSource>> sources,
                   LanguageModelClient llm,
                   ForagerProperties config,
                   SourceChooser chooser,
                   PipelineObserver observer) {
        this.sources  = Collections.unmodifiableMap(new TreeMap<>(sources));
        this.llm      = llm;
        this.config   = config;
        this.chooser  = chooser;
        this.observer = observer;
        this.maxTier  = this.sources.isEmpty() ? 1 : Collections.max(this.sources.keySet());
    }

    // ------------------------------------------------------------------
    // Foraging
    // ------------------------------------------------------------------

    /** Ask the language model for a directed query that avoids {@code recentTopics}. */
    public String generateCuriosity(List<String> recentTopics) {
        return llm.generateCuriosity(recentTopics);
    }

    /**
     * Fetch content from one source of the current tier.
     *
     * With a non-blank curiosity prompt the source is searched; otherwise it
     * returns something random. A source that throws, or that returns blank
     * content, yields an empty result: the session simply tries again later.
     *
     * @throws ConfigurationException if no tier at or below the current one has sources
     */
    public Optional<ForagingResult> forage(String curiosity) {
        ContentSource source;
        synchronized (this) {
            source = chooser.choose(tierSources());
        }

        boolean directed = curiosity != null && !curiosity.isBlank();
        SourceResult result;
        try {
            result = directed ? source.fetch(curiosity) : source.fetchRandom();
        } catch (RuntimeException e) {
            log.warn("Source '{}' failed: {}", source.name(), e.getMessage());
            return Optional.empty();
        }

        if (result == null || result.isEmpty()) {
            log.info("Source '{}' returned empty content for query '{}'", source.name(), curiosity);
            return Optional.empty();
        }
        return Optional.of(new ForagingResult(result, source.name(), directed ? curiosity : null));
    }

    // ------------------------------------------------------------------
    // Tier control
    // ------------------------------------------------------------------

    /** Record a successful sandwich; may promote to the next configured tier. */
    public synchronized void recordSuccess() {
        consecutiveFailures = 0;
        consecutiveSuccesses++;
        if (consecutiveSuccesses >= config.successesToPromote() && currentTier < maxTier) {
            int from = currentTier;
            currentTier++;
            int streak = consecutiveSuccesses;
            consecutiveSuccesses = 0;
            observer.tierChanged(from, currentTier, streak);
        }
        checkStreaks();
    }

    /** Record a failed attempt; may demote to the tier below. */
    public synchronized void recordFailure() {
        consecutiveSuccesses = 0;
        consecutiveFailures++;
        if (consecutiveFailures >= config.failuresToDemote() && currentTier > 1) {
            int from = currentTier;
            currentTier--;
            int streak = consecutiveFailures;
            consecutiveFailures = 0;
            observer.tierChanged(from, currentTier, streak);
        }
        checkStreaks();
    }

    public synchronized int currentTier()          { return currentTier; }
    public synchronized int consecutiveSuccesses() { return consecutiveSuccesses; }
    public synchronized int consecutiveFailures()  { return consecutiveFailures; }

    public ForagerProperties config() { return config; }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    // Current tier first, then each lower tier; the first non-empty one wins.
    private List<ContentSource> tierSources() {
        for (int tier = currentTier; tier >= 1; tier--) {
            List<ContentSource> candidates = sources.get(tier);
            if (candidates != null && !candidates.isEmpty()) {
                if (tier != currentTier) {
                    log.debug("Tier {} has no sources, falling back to tier {}", currentTier, tier);
                }
                return candidates;
            }
        }
        throw new ConfigurationException(
                "No content sources configured at or below tier " + currentTier);
    }

    private void checkStreaks() {
        if (consecutiveSuccesses != 0 && consecutiveFailures != 0) {
            throw new IllegalStateException("Success and failure streaks both nonzero: "
                    + consecutiveSuccesses + "/" + consecutiveFailures);
        }
        if (currentTier < 1 || currentTier > maxTier) {
            throw new IllegalStateException("Tier " + currentTier + " outside [1, " + maxTier + "]");
        }
    }
}
