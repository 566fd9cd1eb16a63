package com.sandwich.orchestrator.service;

import com.sandwich.orchestrator.corpus.CorpusSnapshot;
import com.sandwich.orchestrator.corpus.SandwichCorpus;
import com.sandwich.orchestrator.embedding.EmbeddingService;
import com.sandwich.orchestrator.error.ErrorRouter;
import com.sandwich.orchestrator.error.PipelineException;
import com.sandwich.orchestrator.forager.Forager;
import com.sandwich.orchestrator.forager.ForagerProperties;
import com.sandwich.orchestrator.forager.ForagingResult;
import com.sandwich.orchestrator.forager.SourceChooser;
import com.sandwich.orchestrator.llm.LanguageModelClient;
import com.sandwich.orchestrator.model.AssembledSandwich;
import com.sandwich.orchestrator.model.CandidateStructure;
import com.sandwich.orchestrator.model.PipelineEvent;
import com.sandwich.orchestrator.model.PipelineState;
import com.sandwich.orchestrator.model.SandwichRecord;
import com.sandwich.orchestrator.model.SessionRecord;
import com.sandwich.orchestrator.model.ValidationResult;
import com.sandwich.orchestrator.observe.PipelineObserver;
import com.sandwich.orchestrator.pipeline.ContentPreprocessor;
import com.sandwich.orchestrator.pipeline.ValidationPolicy;
import com.sandwich.orchestrator.pipeline.ValidationPolicy.Verdict;
import com.sandwich.orchestrator.selection.CandidateSelector;
import com.sandwich.orchestrator.selection.SelectedCandidate;
import com.sandwich.orchestrator.selection.SelectionContext;
import com.sandwich.orchestrator.source.SourceCatalog;
import com.sandwich.orchestrator.source.SourceResult;
import com.sandwich.orchestrator.statemachine.Checkpoint;
import com.sandwich.orchestrator.statemachine.CheckpointSink;
import com.sandwich.orchestrator.statemachine.PipelineStateMachine;
import com.sandwich.orchestrator.statemachine.TransitionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.random.RandomGenerator;

import static com.sandwich.orchestrator.model.PipelineEvent.*;

/**
 * Drives one session through the pipeline until it ends.
 *
 * Each iteration starts and finishes in IDLE:
 *   forage → preprocess → identify → select → assemble → validate → store
 * Any step may end the iteration early with a soft outcome (nothing found,
 * content too short, no viable candidate, sandwich rejected), which counts as
 * a forager failure. A {@link PipelineException} moves the session to
 * ERROR_RECOVERY, and {@link ErrorRouter} decides whether it recovers or ends.
 *
 * In IDLE the runner checks the session limits (sandwich count, duration,
 * forage patience) and ends the session with {@code end_session} once one
 * is reached.
 *
 * Blocking: called from a {@link SessionScheduler} worker thread.
 */
@Component
public class PipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final SessionService      sessions;
    private final CheckpointSink      checkpointSink;
    private final PipelineObserver    observer;
    private final ErrorRouter         errorRouter;
    private final SourceCatalog       sourceCatalog;
    private final LanguageModelClient llm;
    private final EmbeddingService    embeddings;
    private final SandwichCorpus      corpus;
    private final CandidateSelector   selector;
    private final ContentPreprocessor preprocessor;
    private final ValidationPolicy    validationPolicy;
    private final ForagerProperties   foragerConfig;

    public PipelineRunner(SessionService sessions,
                          CheckpointSink checkpointSink,
                          PipelineObserver observer,
                          ErrorRouter errorRouter,
                          SourceCatalog sourceCatalog,
                          LanguageModelClient llm,
                          EmbeddingService embeddings,
                          SandwichCorpus corpus,
                          CandidateSelector selector,
                          ContentPreprocessor preprocessor,
                          ValidationPolicy validationPolicy,
                          ForagerProperties foragerConfig) {
        this.sessions         = sessions;
        this.checkpointSink   = checkpointSink;
        this.observer         = observer;
        this.errorRouter      = errorRouter;
        this.sourceCatalog    = sourceCatalog;
        this.llm              = llm;
        this.embeddings       = embeddings;
        this.corpus           = corpus;
        this.selector         = selector;
        this.preprocessor     = preprocessor;
        this.validationPolicy = validationPolicy;
        this.foragerConfig    = foragerConfig;
    }

    // ------------------------------------------------------------------
    // Entry points (called by SessionScheduler)
    // ------------------------------------------------------------------

    /**
     * Run a freshly created session from IDLE until it ends.
     *
     * @return the ended session record
     */
    public SessionRecord run(UUID sessionId) {
        SessionRecord session = load(sessionId);
        return drive(session, new PipelineStateMachine(sessionId, checkpointSink, observer));
    }

    /**
     * Continue a session from its latest checkpoint.
     *
     * A session interrupted mid-iteration is first routed back to IDLE
     * through ERROR_RECOVERY; the partial iteration is abandoned. A session
     * with no checkpoint yet starts from IDLE.
     *
     * @throws IllegalStateException if the session has already ended
     */
    public SessionRecord resume(UUID sessionId) {
        SessionRecord session = load(sessionId);
        if (session.isEnded()) {
            throw new IllegalStateException("Session " + sessionId + " has already ended");
        }

        PipelineStateMachine machine = new PipelineStateMachine(sessionId, checkpointSink, observer);
        Optional<Checkpoint> latest = checkpointSink.latest(sessionId);
        if (latest.isPresent()) {
            Checkpoint checkpoint = latest.get();
            if (TransitionTable.isTerminal(checkpoint.state())) {
                throw new IllegalStateException("Session " + sessionId + " reached "
                        + checkpoint.state() + " and cannot be resumed");
            }
            machine.recoverFromCheckpoint(checkpoint);
            log.info("Resuming session {} from {}", sessionId, checkpoint.transitionReason());
        }
        return drive(session, machine);
    }

    // ------------------------------------------------------------------
    // Session loop
    // ------------------------------------------------------------------

    private SessionRecord drive(SessionRecord session, PipelineStateMachine machine) {
        // Every log line of this session carries its id, in plain-text and JSON output alike.
        MDC.put("sessionId", session.getId().toString());
        try {
            SessionRun run = new SessionRun(session, machine, newForager());
            unwindToIdle(run);
            log.info("Session {} running (sandwiches={}, foragingAttempts={})",
                    session.getId(), run.sandwichesMade, run.foragingAttempts);

            while (!machine.isTerminal()) {
                Optional<String> stop = stopReason(run);
                if (stop.isPresent()) {
                    advance(run, END_SESSION, payload("reason", stop.get()));
                    run.ended = sessions.end(session.getId(), stop.get());
                    break;
                }
                iterate(run);
            }
            return run.ended;
        } finally {
            // Always clear MDC to prevent context leaking to the next task
            MDC.remove("sessionId");
        }
    }

    // One pass from IDLE back to IDLE (or on to SESSION_END).
    private void iterate(SessionRun run) {
        try {
            forageAndBuild(run);
        } catch (PipelineException e) {
            if (!run.machine.canTransition(ERROR)) {
                throw e;
            }
            handleFailure(run, e);
        }
    }

    private void forageAndBuild(SessionRun run) {
        Forager forager = run.forager;

        // ---- Forage ----
        advance(run, START_FORAGING, payload("tier", forager.currentTier()));
        String curiosity = Boolean.TRUE.equals(foragerConfig.useCuriosity())
                ? forager.generateCuriosity(corpus.recentTopics(foragerConfig.recentTopicWindow()))
                : null;
        run.foragingAttempts++;
        Optional<ForagingResult> foraged = forager.forage(curiosity);
        sessions.recordProgress(run.sessionId, run.sandwichesMade, run.foragingAttempts);
        if (foraged.isEmpty()) {
            run.consecutiveForageFailures++;
            advance(run, FORAGE_FAILED, payload("tier", forager.currentTier(), "curiosity", curiosity));
            forager.recordFailure();
            return;
        }
        run.consecutiveForageFailures = 0;
        ForagingResult found = foraged.get();
        SourceResult source = found.sourceResult();
        advance(run, CONTENT_FOUND, payload(
                "source",    found.sourceName(),
                "url",       source.url(),
                "title",     source.title(),
                "curiosity", found.curiosityPrompt()));

        // ---- Preprocess ----
        Optional<String> prepared = preprocessor.prepare(source.content());
        if (prepared.isEmpty()) {
            advance(run, CONTENT_REJECTED, payload("length", source.content().length()));
            forager.recordFailure();
            return;
        }
        String content = prepared.get();
        advance(run, CONTENT_ACCEPTED, payload("length", content.length()));

        // ---- Identify ----
        List<CandidateStructure> candidates = llm.identifyCandidates(content);
        if (candidates.isEmpty()) {
            advance(run, NO_CANDIDATES, payload("url", source.url()));
            forager.recordFailure();
            return;
        }
        advance(run, CANDIDATES_FOUND, payload("count", candidates.size()));

        // ---- Select ----
        Optional<SelectedCandidate> selected = selector.select(candidates, selectionContext(candidates));
        if (selected.isEmpty()) {
            advance(run, NONE_VIABLE, payload("count", candidates.size()));
            forager.recordFailure();
            return;
        }
        SelectedCandidate choice = selected.get();
        CandidateStructure candidate = choice.candidate();
        advance(run, CANDIDATE_SELECTED, payload(
                "structure_type", candidate.structureType(),
                "confidence",     candidate.confidence(),
                "final_score",    choice.finalScore(),
                "rationale",      choice.rationale()));

        // ---- Assemble ----
        AssembledSandwich sandwich = llm.assemble(candidate, content);
        advance(run, ASSEMBLY_COMPLETE, payload("name", sandwich.name()));

        // ---- Validate ----
        ValidationResult validation = llm.validate(sandwich, content);
        Verdict verdict = validationPolicy.decide(validation);
        advance(run, verdict.event(), payload(
                "name",          sandwich.name(),
                "overall_score", validation.overallScore()));
        if (verdict == Verdict.REJECTED) {
            forager.recordFailure();
            return;
        }

        // ---- Store ----
        double[] embedding = embeddings.embed(sandwich.embeddingText());
        SandwichRecord stored = corpus.store(run.sessionId, sandwich, validation.overallScore(),
                verdict.status(), source.url(), embedding);
        run.sandwichesMade++;
        sessions.recordProgress(run.sessionId, run.sandwichesMade, run.foragingAttempts);
        advance(run, STORED, payload(
                "sandwich_id", String.valueOf(stored.getId()),
                "status",      verdict.status().name()));
        forager.recordSuccess();
    }

    private void handleFailure(SessionRun run, PipelineException failure) {
        advance(run, ERROR, payload(
                "kind",     failure.getKind().name(),
                "reason",   failure.getReason(),
                "attempts", failure.getAttempts(),
                "message",  failure.getMessage()));

        PipelineEvent outcome = errorRouter.classify(failure);
        advance(run, outcome, payload("kind", failure.getKind().name(), "reason", failure.getReason()));
        if (outcome == FATAL) {
            run.ended = sessions.end(run.sessionId, "fatal_error:" + failure.getReason());
        } else {
            run.forager.recordFailure();
        }
    }

    // A resumed session may stop anywhere; abandon the partial iteration.
    private void unwindToIdle(SessionRun run) {
        PipelineState state = run.machine.currentState();
        if (state == PipelineState.IDLE || run.machine.isTerminal()) {
            return;
        }
        if (state != PipelineState.ERROR_RECOVERY) {
            advance(run, ERROR, payload("reason", "resumed", "interrupted_state", state.value()));
        } else if (fatalPending(run.machine)) {
            // Crashed between classifying a fatal failure and ending the session.
            Map<String, Object> failure = run.machine.latestCheckpoint().orElseThrow().payload();
            String reason = String.valueOf(failure.get("reason"));
            advance(run, FATAL, payload("kind", PipelineException.Kind.FATAL.name(), "reason", reason));
            run.ended = sessions.end(run.sessionId, "fatal_error:" + reason);
            return;
        }
        advance(run, RECOVERED, payload("reason", "resumed"));
    }

    private static boolean fatalPending(PipelineStateMachine machine) {
        return machine.latestCheckpoint()
                .map(cp -> PipelineException.Kind.FATAL.name().equals(cp.payload().get("kind")))
                .orElse(false);
    }

    private Optional<String> stopReason(SessionRun run) {
        Integer maxSandwiches = run.session.getMaxSandwiches();
        if (maxSandwiches != null && run.sandwichesMade >= maxSandwiches) {
            return Optional.of("max_sandwiches");
        }
        Integer maxMinutes = run.session.getMaxDurationMinutes();
        if (maxMinutes != null
                && Duration.between(run.startedAt, Instant.now()).compareTo(Duration.ofMinutes(maxMinutes)) >= 0) {
            return Optional.of("max_duration");
        }
        if (run.consecutiveForageFailures >= foragerConfig.maxPatience()) {
            return Optional.of("patience_exhausted");
        }
        return Optional.empty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    // Candidate embeddings are only worth computing when there is a corpus to compare with.
    private SelectionContext selectionContext(List<CandidateStructure> candidates) {
        CorpusSnapshot snapshot = corpus.snapshot();
        if (snapshot.isEmpty()) {
            return SelectionContext.empty();
        }
        List<double[]> candidateEmbeddings = candidates.stream()
                .map(c -> embeddings.embed(c.conceptText()))
                .toList();
        return new SelectionContext(snapshot.sandwichEmbeddings(), candidateEmbeddings,
                snapshot.structureTypeFrequencies());
    }

    private void advance(SessionRun run, PipelineEvent event, Map<String, Object> payload) {
        PipelineState next = run.machine.transition(event, payload);
        sessions.recordState(run.sessionId, next);
    }

    private Forager newForager() {
        return new Forager(sourceCatalog.tiers(), llm, foragerConfig,
                SourceChooser.uniform(RandomGenerator.getDefault()), observer);
    }

    private SessionRecord load(UUID sessionId) {
        return sessions.findById(sessionId)
                .orElseThrow(() -> new NoSuchElementException("Session not found: " + sessionId));
    }

    // Key/value pairs; values may be null.
    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    /** Mutable bookkeeping for one run of one session; confined to the worker thread. */
    private static final class SessionRun {
        final UUID                 sessionId;
        final SessionRecord        session;
        final PipelineStateMachine machine;
        final Forager              forager;
        final Instant              startedAt = Instant.now();

        int           sandwichesMade;
        int           foragingAttempts;
        int           consecutiveForageFailures;
        SessionRecord ended;

        SessionRun(SessionRecord session, PipelineStateMachine machine, Forager forager) {
            this.sessionId        = session.getId();
            this.session          = session;
            this.machine          = machine;
            this.forager          = forager;
            this.sandwichesMade   = session.getSandwichesMade();
            this.foragingAttempts = session.getForagingAttempts();
        }
    }
}
