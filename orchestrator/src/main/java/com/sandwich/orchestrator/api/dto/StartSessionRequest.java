package com.sandwich.orchestrator.api.dto;

/**
 * Request body for POST /sessions.
 *
 * Both limits are optional; a session without any limit runs until its
 * forage patience runs out or a fatal error ends it.
 */
public record StartSessionRequest(
        Integer maxSandwiches,
        Integer maxDurationMinutes
) {}
