package com.sandwich.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A stored sandwich: the artifact one successful pipeline iteration produces.
 *
 * The embedding is kept as a JSON array of doubles; the corpus decodes it
 * when building a snapshot for novelty scoring.
 *
 * DB table: sandwiches  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "sandwiches")
public class SandwichRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "bread_top", nullable = false, columnDefinition = "TEXT")
    private String breadTop;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String filling;

    @Column(name = "bread_bottom", nullable = false, columnDefinition = "TEXT")
    private String breadBottom;

    @Column(name = "structure_type", nullable = false)
    private String structureType;

    @Column(name = "validity_score", nullable = false)
    private double validityScore;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SandwichStatus status;

    @Column(name = "source_url", columnDefinition = "TEXT")
    private String sourceUrl;

    @Column(name = "embedding_json", columnDefinition = "TEXT")
    private String embeddingJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected SandwichRecord() {}   // required by JPA

    public SandwichRecord(UUID sessionId, AssembledSandwich sandwich, double validityScore,
                          SandwichStatus status, String sourceUrl, String embeddingJson) {
        this.sessionId     = sessionId;
        this.name          = sandwich.name();
        this.description   = sandwich.description();
        this.breadTop      = sandwich.breadTop();
        this.filling       = sandwich.filling();
        this.breadBottom   = sandwich.breadBottom();
        this.structureType = sandwich.structureType();
        this.validityScore = validityScore;
        this.status        = status;
        this.sourceUrl     = sourceUrl;
        this.embeddingJson = embeddingJson;
    }

    public UUID           getId()            { return id; }
    public UUID           getSessionId()     { return sessionId; }
    public String         getName()          { return name; }
    public String         getDescription()   { return description; }
    public String         getBreadTop()      { return breadTop; }
    public String         getFilling()       { return filling; }
    public String         getBreadBottom()   { return breadBottom; }
    public String         getStructureType() { return structureType; }
    public double         getValidityScore() { return validityScore; }
    public SandwichStatus getStatus()        { return status; }
    public String         getSourceUrl()     { return sourceUrl; }
    public String         getEmbeddingJson() { return embeddingJson; }
    public Instant        getCreatedAt()     { return createdAt; }
}
