package com.sandwich.orchestrator.statemachine;

import java.util.Optional;
import java.util.UUID;

/**
 * Durable home for checkpoints.
 *
 * The state machine appends every checkpoint it creates; after a restart the
 * orchestrator looks up the latest checkpoint of a session to resume it.
 */
public interface CheckpointSink {

    void append(Checkpoint checkpoint);

    Optional<Checkpoint> latest(UUID sessionId);
}
