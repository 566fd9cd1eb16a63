package com.sandwich.orchestrator.model;

/**
 * Status of a stored sandwich.
 *
 *   ACCEPTED       : validation score cleared the accept threshold
 *   PENDING_REVIEW : stored, but flagged for a human look
 */
public enum SandwichStatus {
    ACCEPTED,
    PENDING_REVIEW
}
