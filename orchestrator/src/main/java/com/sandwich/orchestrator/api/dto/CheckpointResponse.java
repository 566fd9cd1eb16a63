package com.sandwich.orchestrator.api.dto;

import com.sandwich.orchestrator.statemachine.Checkpoint;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One entry of GET /sessions/{id}/checkpoints.
 */
public record CheckpointResponse(
        UUID                id,
        String              state,
        Instant             createdAt,
        String              transitionReason,
        Map<String, Object> payload
) {
    public static CheckpointResponse from(Checkpoint c) {
        return new CheckpointResponse(
                c.id(),
                c.state().value(),
                c.createdAt(),
                c.transitionReason(),
                c.payload()
        );
    }
}
