package com.sandwich.orchestrator.observe;

import com.sandwich.orchestrator.error.PipelineException;
import com.sandwich.orchestrator.model.PipelineEvent;
import com.sandwich.orchestrator.model.PipelineState;
import com.sandwich.orchestrator.statemachine.Checkpoint;

/**
 * Receives the diagnostics a session emits: every transition, every
 * classified failure, every tier change.
 *
 * Components get an observer through their constructor instead of writing
 * to a static logger, so tests can verify what was reported with a plain
 * Mockito mock. Together with the checkpoint log these calls are enough to
 * reconstruct a session after the fact.
 */
public interface PipelineObserver {

    /** A legal transition was applied and {@code checkpoint} appended. */
    void transitioned(PipelineState from, PipelineEvent event, Checkpoint checkpoint);

    /** A state machine was restored from {@code checkpoint} without a transition. */
    void recovered(Checkpoint checkpoint);

    /** The error router turned {@code failure} into {@code event}. */
    void failureClassified(PipelineException failure, PipelineEvent event);

    /** The forager moved from one source tier to another. */
    void tierChanged(int fromTier, int toTier, int streak);
}
