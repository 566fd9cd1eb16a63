package com.sandwich.orchestrator.model;

import java.util.Locale;

/**
 * States of one sandwich-making session.
 *
 * Transitions (happy path):
 *   IDLE → FORAGING → PREPROCESSING → IDENTIFYING → SELECTING
 *        → ASSEMBLING → VALIDATING → STORING → IDLE
 *
 * Every working state can fall into ERROR_RECOVERY, which either returns to
 * IDLE (recovered) or ends the session (fatal). SESSION_END is terminal.
 * The full table lives in {@link com.sandwich.orchestrator.statemachine.TransitionTable}.
 */
public enum PipelineState {
    IDLE,
    FORAGING,
    PREPROCESSING,
    IDENTIFYING,
    SELECTING,
    ASSEMBLING,
    VALIDATING,
    STORING,
    ERROR_RECOVERY,
    SESSION_END;

    /** Lower-case name used in checkpoint descriptions and log lines. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
