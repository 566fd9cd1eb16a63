package com.sandwich.orchestrator.statemachine;

import com.sandwich.orchestrator.model.PipelineEvent;
import com.sandwich.orchestrator.model.PipelineState;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable record of one state-machine transition.
 *
 * The latest checkpoint of a session is enough to resume it: its state is
 * the state the session was in, and its payload carries the state-specific
 * context (the chosen candidate, the foraged URL, ...).
 *
 * @param transitionReason {@code "<from> --[<event>]--> <to>"}
 */
public record Checkpoint(
        UUID                id,
        UUID                sessionId,
        PipelineState       state,
        Instant             createdAt,
        Map<String, Object> payload,
        String              transitionReason
) {

    public Checkpoint {
        // Payload values may legitimately be null (e.g. a missing URL), so Map.copyOf is out.
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /** Build the checkpoint for a transition that is about to be applied. */
    public static Checkpoint forTransition(UUID sessionId, PipelineState from, PipelineEvent event,
                                           PipelineState to, Map<String, Object> payload) {
        return new Checkpoint(
                UUID.randomUUID(),
                sessionId,
                to,
                Instant.now(),
                payload,
                describe(from, event, to));
    }

    static String describe(PipelineState from, PipelineEvent event, PipelineState to) {
        return from.value() + " --[" + event.value() + "]--> " + to.value();
    }
}
