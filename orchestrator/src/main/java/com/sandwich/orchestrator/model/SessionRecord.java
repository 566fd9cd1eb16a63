package com.sandwich.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One sandwich-making session.
 *
 * The in-memory state machine owns the authoritative state while the session
 * runs; this row mirrors it together with the session statistics so that a
 * restarted orchestrator (or the REST API) can see how far a session got.
 *
 * DB table: sessions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "sessions")
public class SessionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PipelineState state = PipelineState.IDLE;

    // Limits requested at start; null means "no limit".
    @Column(name = "max_sandwiches")
    private Integer maxSandwiches;

    @Column(name = "max_duration_minutes")
    private Integer maxDurationMinutes;

    @Column(name = "sandwiches_made", nullable = false)
    private int sandwichesMade = 0;

    @Column(name = "foraging_attempts", nullable = false)
    private int foragingAttempts = 0;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt = Instant.now();

    @Column(name = "ended_at")
    private Instant endedAt;

    // Why the session stopped: "max_sandwiches", "fatal_error", ...
    @Column(name = "end_reason")
    private String endReason;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected SessionRecord() {}   // required by JPA

    public SessionRecord(Integer maxSandwiches, Integer maxDurationMinutes) {
        this.maxSandwiches      = maxSandwiches;
        this.maxDurationMinutes = maxDurationMinutes;
    }

    /** A session whose id is already known, e.g. one rebuilt outside the persistence context. */
    public SessionRecord(UUID id, Integer maxSandwiches, Integer maxDurationMinutes) {
        this(maxSandwiches, maxDurationMinutes);
        this.id = id;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()                 { return id; }
    public PipelineState getState()              { return state; }
    public Integer       getMaxSandwiches()      { return maxSandwiches; }
    public Integer       getMaxDurationMinutes() { return maxDurationMinutes; }
    public int           getSandwichesMade()     { return sandwichesMade; }
    public int           getForagingAttempts()   { return foragingAttempts; }
    public Instant       getStartedAt()          { return startedAt; }
    public Instant       getEndedAt()            { return endedAt; }
    public String        getEndReason()          { return endReason; }
    public Instant       getUpdatedAt()          { return updatedAt; }

    public void setState(PipelineState state)      { this.state = state; }
    public void setSandwichesMade(int v)           { this.sandwichesMade = v; }
    public void setForagingAttempts(int v)         { this.foragingAttempts = v; }
    public void setEndedAt(Instant t)              { this.endedAt = t; }
    public void setEndReason(String endReason)     { this.endReason = endReason; }

    public boolean isEnded() { return endedAt != null; }
}
