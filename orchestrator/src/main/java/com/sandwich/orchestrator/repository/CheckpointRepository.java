package com.sandwich.orchestrator.repository;

import com.sandwich.orchestrator.model.CheckpointRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append + lookup operations for the state_checkpoints table.
 */
public interface CheckpointRepository extends JpaRepository<CheckpointRecord, UUID> {

    /** The most recent checkpoint of a session, the resume point after a crash. */
    Optional<CheckpointRecord> findFirstBySessionIdOrderBySeqDesc(UUID sessionId);

    /** Full checkpoint log of a session, in insertion order. */
    List<CheckpointRecord> findBySessionIdOrderBySeqAsc(UUID sessionId);
}
