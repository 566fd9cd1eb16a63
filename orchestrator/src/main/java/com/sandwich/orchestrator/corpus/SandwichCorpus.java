package com.sandwich.orchestrator.corpus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandwich.orchestrator.error.PipelineException;
import com.sandwich.orchestrator.model.AssembledSandwich;
import com.sandwich.orchestrator.model.SandwichRecord;
import com.sandwich.orchestrator.model.SandwichStatus;
import com.sandwich.orchestrator.repository.SandwichRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The persistent collection of sandwiches, backed by the sandwiches table.
 *
 * Embeddings are stored as JSON arrays and decoded when a snapshot is taken.
 */
@Service
public class SandwichCorpus {

    private static final Logger log = LoggerFactory.getLogger(SandwichCorpus.class);

    private final SandwichRepository sandwiches;
    private final ObjectMapper       json;

    public SandwichCorpus(SandwichRepository sandwiches, ObjectMapper objectMapper) {
        this.sandwiches = sandwiches;
        this.json       = objectMapper;
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public CorpusSnapshot snapshot() {
        List<SandwichRecord> all;
        try {
            all = sandwiches.findAll();
        } catch (DataAccessException e) {
            throw PipelineException.fatal("database_unavailable", "Could not load sandwich corpus", e);
        }

        List<double[]> embeddings = new ArrayList<>();
        Map<String, Integer> typeCounts = new HashMap<>();
        for (SandwichRecord record : all) {
            typeCounts.merge(record.getStructureType(), 1, Integer::sum);
            double[] embedding = decode(record);
            if (embedding != null) {
                embeddings.add(embedding);
            }
        }
        return new CorpusSnapshot(embeddings, typeCounts, all.size());
    }

    /** Names of the {@code limit} most recently stored sandwiches, newest first. */
    @Transactional(readOnly = true)
    public List<String> recentTopics(int limit) {
        return sandwiches.findByOrderByCreatedAtDesc(PageRequest.of(0, limit)).stream()
                .map(SandwichRecord::getName)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<SandwichRecord> sandwichesFor(UUID sessionId) {
        return sandwiches.findBySessionIdOrderByCreatedAtAsc(sessionId);
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    /**
     * Persist a sandwich produced by the pipeline.
     *
     * @param embedding may be null when no embedding was computed
     * @throws PipelineException FATAL when the store is unavailable
     */
    @Transactional
    public SandwichRecord store(UUID sessionId, AssembledSandwich sandwich, double validityScore,
                                SandwichStatus status, String sourceUrl, double[] embedding) {
        try {
            SandwichRecord saved = sandwiches.save(new SandwichRecord(
                    sessionId, sandwich, validityScore, status, sourceUrl, encode(embedding)));
            log.info("Stored sandwich '{}' ({}, validity {})", saved.getName(), status, validityScore);
            return saved;
        } catch (DataAccessException e) {
            throw PipelineException.fatal("database_unavailable", "Could not store sandwich '" + sandwich.name() + "'", e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String encode(double[] embedding) {
        if (embedding == null) {
            return null;
        }
        try {
            return json.writeValueAsString(embedding);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialise embedding", e);
        }
    }

    private double[] decode(SandwichRecord record) {
        if (record.getEmbeddingJson() == null || record.getEmbeddingJson().isBlank()) {
            return null;
        }
        try {
            return json.readValue(record.getEmbeddingJson(), double[].class);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable embedding on sandwich {}: {}", record.getId(), e.getOriginalMessage());
            return null;
        }
    }
}
