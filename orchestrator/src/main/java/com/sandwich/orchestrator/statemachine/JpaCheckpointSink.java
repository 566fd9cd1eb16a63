package com.sandwich.orchestrator.statemachine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandwich.orchestrator.error.PipelineException;
import com.sandwich.orchestrator.model.CheckpointRecord;
import com.sandwich.orchestrator.repository.CheckpointRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores checkpoints in the state_checkpoints table.
 *
 * The payload map is written as JSON text; on the way back it is decoded
 * into plain maps, lists, strings and numbers.
 */
@Component
public class JpaCheckpointSink implements CheckpointSink {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final CheckpointRepository repo;
    private final ObjectMapper         json;

    public JpaCheckpointSink(CheckpointRepository repo, ObjectMapper objectMapper) {
        this.repo = repo;
        this.json = objectMapper;
    }

    /**
     * Persist one checkpoint.
     *
     * @throws PipelineException FATAL when the database cannot be reached;
     *         a session that cannot checkpoint cannot be resumed either
     */
    @Override
    @Transactional
    public void append(Checkpoint checkpoint) {
        try {
            repo.save(new CheckpointRecord(
                    checkpoint.id(),
                    checkpoint.sessionId(),
                    checkpoint.state(),
                    checkpoint.createdAt(),
                    json.writeValueAsString(checkpoint.payload()),
                    checkpoint.transitionReason()));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Checkpoint payload is not serializable: " + checkpoint.payload().keySet(), e);
        } catch (DataAccessException e) {
            throw PipelineException.fatal("database_unavailable",
                    "Could not persist checkpoint " + checkpoint.id(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Checkpoint> latest(UUID sessionId) {
        return repo.findFirstBySessionIdOrderBySeqDesc(sessionId).map(this::toCheckpoint);
    }

    /** Full log of a session, oldest first. */
    @Transactional(readOnly = true)
    public List<Checkpoint> history(UUID sessionId) {
        return repo.findBySessionIdOrderBySeqAsc(sessionId).stream()
                .map(this::toCheckpoint)
                .toList();
    }

    private Checkpoint toCheckpoint(CheckpointRecord r) {
        Map<String, Object> payload;
        try {
            payload = r.getPayloadJson() == null ? Map.of() : json.readValue(r.getPayloadJson(), PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt payload in checkpoint " + r.getId(), e);
        }
        return new Checkpoint(r.getId(), r.getSessionId(), r.getState(), r.getCreatedAt(),
                payload, r.getTransitionReason());
    }
}
