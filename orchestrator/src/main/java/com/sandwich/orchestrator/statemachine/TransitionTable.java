package com.sandwich.orchestrator.statemachine;

import com.sandwich.orchestrator.model.PipelineEvent;
import com.sandwich.orchestrator.model.PipelineState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.sandwich.orchestrator.model.PipelineEvent.*;
import static com.sandwich.orchestrator.model.PipelineState.*;

/**
 * The complete set of legal transitions: current state → { event → next state }.
 *
 * Any (state, event) pair missing from this table is illegal. SESSION_END
 * has an empty row.
 */
public final class TransitionTable {

    private static final Map<PipelineState, Map<PipelineEvent, PipelineState>> TABLE =
            new EnumMap<>(PipelineState.class);

    static {
        row(IDLE,
                START_FORAGING, FORAGING,
                END_SESSION,    SESSION_END);
        row(FORAGING,
                CONTENT_FOUND,  PREPROCESSING,
                FORAGE_FAILED,  IDLE,
                ERROR,          ERROR_RECOVERY);
        row(PREPROCESSING,
                CONTENT_ACCEPTED, IDENTIFYING,
                CONTENT_REJECTED, IDLE,
                ERROR,            ERROR_RECOVERY);
        row(IDENTIFYING,
                CANDIDATES_FOUND, SELECTING,
                NO_CANDIDATES,    IDLE,
                ERROR,            ERROR_RECOVERY);
        row(SELECTING,
                CANDIDATE_SELECTED, ASSEMBLING,
                NONE_VIABLE,        IDLE,
                ERROR,              ERROR_RECOVERY);
        row(ASSEMBLING,
                ASSEMBLY_COMPLETE, VALIDATING,
                ERROR,             ERROR_RECOVERY);
        row(VALIDATING,
                ACCEPTED, STORING,
                REVIEW,   STORING,
                REJECTED, IDLE,
                ERROR,    ERROR_RECOVERY);
        row(STORING,
                STORED, IDLE,
                ERROR,  ERROR_RECOVERY);
        row(ERROR_RECOVERY,
                RECOVERED, IDLE,
                FATAL,     SESSION_END);
        row(SESSION_END);
    }

    private TransitionTable() {}

    /** The state {@code event} leads to from {@code state}, or empty if illegal. */
    public static Optional<PipelineState> next(PipelineState state, PipelineEvent event) {
        return Optional.ofNullable(TABLE.get(state).get(event));
    }

    /** Events accepted in {@code state}; empty for SESSION_END. */
    public static Set<PipelineEvent> legalEvents(PipelineState state) {
        return TABLE.get(state).keySet();
    }

    public static boolean isTerminal(PipelineState state) {
        return TABLE.get(state).isEmpty();
    }

    // Pairs of (event, target) in declaration order.
    private static void row(PipelineState from, Object... eventTargetPairs) {
        Map<PipelineEvent, PipelineState> events = new EnumMap<>(PipelineEvent.class);
        for (int i = 0; i < eventTargetPairs.length; i += 2) {
            events.put((PipelineEvent) eventTargetPairs[i], (PipelineState) eventTargetPairs[i + 1]);
        }
        TABLE.put(from, Collections.unmodifiableMap(events));
    }
}
