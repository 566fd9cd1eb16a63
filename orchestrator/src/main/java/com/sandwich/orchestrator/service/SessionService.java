package com.sandwich.orchestrator.service;

import com.sandwich.orchestrator.model.PipelineState;
import com.sandwich.orchestrator.model.SessionRecord;
import com.sandwich.orchestrator.repository.SessionRepository;
import com.sandwich.orchestrator.statemachine.Checkpoint;
import com.sandwich.orchestrator.statemachine.JpaCheckpointSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

/**
 * Session bookkeeping: creation, progress mirroring and ending.
 *
 * The running state machine is authoritative; these rows are what the REST
 * API and a restarted orchestrator see.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final SessionRepository sessionRepo;
    private final JpaCheckpointSink checkpoints;

    public SessionService(SessionRepository sessionRepo, JpaCheckpointSink checkpoints) {
        this.sessionRepo = sessionRepo;
        this.checkpoints = checkpoints;
    }

    // ------------------------------------------------------------------
    // Creation and lookup
    // ------------------------------------------------------------------

    /**
     * Create a new session in IDLE.
     *
     * @param maxSandwiches      stop after this many stored sandwiches; null for no limit
     * @param maxDurationMinutes stop after this many minutes; null for no limit
     */
    @Transactional
    public SessionRecord create(Integer maxSandwiches, Integer maxDurationMinutes) {
        if (maxSandwiches != null && maxSandwiches <= 0) {
            throw new IllegalArgumentException("maxSandwiches must be positive, got " + maxSandwiches);
        }
        if (maxDurationMinutes != null && maxDurationMinutes <= 0) {
            throw new IllegalArgumentException("maxDurationMinutes must be positive, got " + maxDurationMinutes);
        }
        SessionRecord session = sessionRepo.save(new SessionRecord(maxSandwiches, maxDurationMinutes));
        log.info("Created session {} (maxSandwiches={}, maxDurationMinutes={})",
                session.getId(), maxSandwiches, maxDurationMinutes);
        return session;
    }

    @Transactional(readOnly = true)
    public Optional<SessionRecord> findById(UUID id) {
        return sessionRepo.findById(id);
    }

    /** IDs of sessions with no end time, oldest first. */
    @Transactional(readOnly = true)
    public List<UUID> unfinishedSessionIds() {
        return sessionRepo.findByEndedAtIsNullOrderByStartedAtAsc().stream()
                .map(SessionRecord::getId)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Checkpoint> checkpoints(UUID sessionId) {
        return checkpoints.history(sessionId);
    }

    // ------------------------------------------------------------------
    // Progress (called by the runner from a worker thread)
    // ------------------------------------------------------------------

    @Transactional
    public void recordState(UUID sessionId, PipelineState state) {
        SessionRecord session = load(sessionId);
        session.setState(state);
        sessionRepo.save(session);
    }

    @Transactional
    public void recordProgress(UUID sessionId, int sandwichesMade, int foragingAttempts) {
        SessionRecord session = load(sessionId);
        session.setSandwichesMade(sandwichesMade);
        session.setForagingAttempts(foragingAttempts);
        sessionRepo.save(session);
    }

    /**
     * Mark a session as ended. A session that has already ended keeps its
     * original end time and reason.
     */
    @Transactional
    public SessionRecord end(UUID sessionId, String reason) {
        SessionRecord session = load(sessionId);
        if (session.isEnded()) {
            log.debug("Session {} already ended ({})", sessionId, session.getEndReason());
            return session;
        }
        session.setEndedAt(Instant.now());
        session.setEndReason(reason);
        log.info("Session {} ended: {} (sandwiches={}, foragingAttempts={})",
                sessionId, reason, session.getSandwichesMade(), session.getForagingAttempts());
        return sessionRepo.save(session);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private SessionRecord load(UUID sessionId) {
        return sessionRepo.findById(sessionId)
                .orElseThrow(() -> new NoSuchElementException("Session not found: " + sessionId));
    }
}
