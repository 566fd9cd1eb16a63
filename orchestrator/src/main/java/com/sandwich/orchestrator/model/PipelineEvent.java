package com.sandwich.orchestrator.model;

/**
 * Events that drive the session state machine.
 *
 * Each constant carries the snake_case name used in checkpoint descriptions,
 * logs and the REST API, e.g. {@code start_foraging}.
 */
public enum PipelineEvent {
    START_FORAGING("start_foraging"),
    END_SESSION("end_session"),
    CONTENT_FOUND("content_found"),
    FORAGE_FAILED("forage_failed"),
    CONTENT_ACCEPTED("content_accepted"),
    CONTENT_REJECTED("content_rejected"),
    CANDIDATES_FOUND("candidates_found"),
    NO_CANDIDATES("no_candidates"),
    CANDIDATE_SELECTED("candidate_selected"),
    NONE_VIABLE("none_viable"),
    ASSEMBLY_COMPLETE("assembly_complete"),
    ACCEPTED("accepted"),
    REVIEW("review"),
    REJECTED("rejected"),
    STORED("stored"),
    ERROR("error"),
    RECOVERED("recovered"),
    FATAL("fatal");

    private final String value;

    PipelineEvent(String value) {
        this.value = value;
    }

    public String value() { return value; }

    @Override
    public String toString() {
        return value;
    }
}
