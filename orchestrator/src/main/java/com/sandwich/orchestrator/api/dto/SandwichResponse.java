package com.sandwich.orchestrator.api.dto;

import com.sandwich.orchestrator.model.SandwichRecord;
import com.sandwich.orchestrator.model.SandwichStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * A stored sandwich as returned by GET /sessions/{id}/sandwiches.
 * The embedding is left out.
 */
public record SandwichResponse(
        UUID           id,
        String         name,
        String         description,
        String         breadTop,
        String         filling,
        String         breadBottom,
        String         structureType,
        double         validityScore,
        SandwichStatus status,
        String         sourceUrl,
        Instant        createdAt
) {
    public static SandwichResponse from(SandwichRecord s) {
        return new SandwichResponse(
                s.getId(),
                s.getName(),
                s.getDescription(),
                s.getBreadTop(),
                s.getFilling(),
                s.getBreadBottom(),
                s.getStructureType(),
                s.getValidityScore(),
                s.getStatus(),
                s.getSourceUrl(),
                s.getCreatedAt()
        );
    }
}
