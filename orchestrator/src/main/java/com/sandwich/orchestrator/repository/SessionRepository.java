package com.sandwich.orchestrator.repository;

import com.sandwich.orchestrator.model.SessionRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + query operations for the sessions table.
 */
public interface SessionRepository extends JpaRepository<SessionRecord, UUID> {

    /** Sessions that have not ended yet (candidates for resume after a restart). */
    List<SessionRecord> findByEndedAtIsNullOrderByStartedAtAsc();
}
