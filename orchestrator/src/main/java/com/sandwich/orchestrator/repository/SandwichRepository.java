package com.sandwich.orchestrator.repository;

import com.sandwich.orchestrator.model.SandwichRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD operations for the sandwiches table.
 */
public interface SandwichRepository extends JpaRepository<SandwichRecord, UUID> {

    List<SandwichRecord> findBySessionIdOrderByCreatedAtAsc(UUID sessionId);

    /** Most recent sandwiches first; used to steer curiosity away from repeats. */
    List<SandwichRecord> findByOrderByCreatedAtDesc(Pageable page);
}
