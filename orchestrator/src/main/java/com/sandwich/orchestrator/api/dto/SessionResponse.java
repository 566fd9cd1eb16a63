package com.sandwich.orchestrator.api.dto;

import com.sandwich.orchestrator.model.SessionRecord;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /sessions and GET /sessions/{id}.
 */
public record SessionResponse(
        UUID    id,
        String  state,
        Integer maxSandwiches,
        Integer maxDurationMinutes,
        int     sandwichesMade,
        int     foragingAttempts,
        Instant startedAt,
        Instant endedAt,
        String  endReason,
        boolean running
) {
    public static SessionResponse from(SessionRecord s, boolean running) {
        return new SessionResponse(
                s.getId(),
                s.getState().value(),
                s.getMaxSandwiches(),
                s.getMaxDurationMinutes(),
                s.getSandwichesMade(),
                s.getForagingAttempts(),
                s.getStartedAt(),
                s.getEndedAt(),
                s.getEndReason(),
                running
        );
    }
}
