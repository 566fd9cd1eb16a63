package com.sandwich.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.Generated;

import java.time.Instant;
import java.util.UUID;

/**
 * Persistent copy of one state-machine checkpoint.
 *
 * Rows are append-only. The id is the checkpoint's own id (assigned by the
 * state machine, not generated here) so a checkpoint keeps its identity across
 * a restart. Order within a session comes from {@code seq}, a database
 * identity assigned on insert.
 *
 * DB table: state_checkpoints  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "state_checkpoints")
public class CheckpointRecord {

    @Id
    private UUID id;

    @Generated
    @Column(insertable = false, updatable = false)
    private Long seq;

    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private PipelineState state;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    // State-specific context, JSON-encoded.
    @Column(name = "payload_json", columnDefinition = "TEXT", updatable = false)
    private String payloadJson;

    @Column(name = "transition_reason", nullable = false, updatable = false)
    private String transitionReason;

    protected CheckpointRecord() {}   // required by JPA

    public CheckpointRecord(UUID id, UUID sessionId, PipelineState state, Instant createdAt,
                            String payloadJson, String transitionReason) {
        this.id               = id;
        this.sessionId        = sessionId;
        this.state            = state;
        this.createdAt        = createdAt;
        this.payloadJson      = payloadJson;
        this.transitionReason = transitionReason;
    }

    public UUID          getId()               { return id; }
    public UUID          getSessionId()        { return sessionId; }
    public PipelineState getState()            { return state; }
    public Instant       getCreatedAt()        { return createdAt; }
    public String        getPayloadJson()      { return payloadJson; }
    public String        getTransitionReason() { return transitionReason; }
}
