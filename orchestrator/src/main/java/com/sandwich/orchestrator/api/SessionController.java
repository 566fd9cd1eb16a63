package com.sandwich.orchestrator.api;

import com.sandwich.orchestrator.api.dto.CheckpointResponse;
import com.sandwich.orchestrator.api.dto.SandwichResponse;
import com.sandwich.orchestrator.api.dto.SessionResponse;
import com.sandwich.orchestrator.api.dto.StartSessionRequest;
import com.sandwich.orchestrator.corpus.SandwichCorpus;
import com.sandwich.orchestrator.model.SessionRecord;
import com.sandwich.orchestrator.service.SessionScheduler;
import com.sandwich.orchestrator.service.SessionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for session lifecycle.
 *
 * POST /sessions                  : start a new sandwich-making session
 * GET  /sessions/{id}             : poll the state and statistics of a session
 * GET  /sessions/{id}/checkpoints : the session's transition log, oldest first
 * GET  /sessions/{id}/sandwiches  : sandwiches the session stored
 * POST /sessions/{id}/resume      : continue an interrupted session from its latest checkpoint
 */
@RestController
@RequestMapping("/sessions")
public class SessionController {

    private final SessionService   sessionService;
    private final SessionScheduler scheduler;
    private final SandwichCorpus   corpus;

    public SessionController(SessionService sessionService, SessionScheduler scheduler, SandwichCorpus corpus) {
        this.sessionService = sessionService;
        this.scheduler      = scheduler;
        this.corpus         = corpus;
    }

    /**
     * Start a new session.
     *
     * Example:
     *   curl -X POST http://localhost:8080/sessions \
     *     -H "Content-Type: application/json" \
     *     -d '{"maxSandwiches":3,"maxDurationMinutes":30}'
     */
    @PostMapping
    public ResponseEntity<SessionResponse> start(@RequestBody(required = false) StartSessionRequest req) {
        StartSessionRequest body = req == null ? new StartSessionRequest(null, null) : req;
        SessionRecord session;
        try {
            session = sessionService.create(body.maxSandwiches(), body.maxDurationMinutes());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        scheduler.start(session.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.from(session, true));
    }

    @GetMapping("/{id}")
    public SessionResponse getSession(@PathVariable UUID id) {
        return SessionResponse.from(find(id), scheduler.isRunning(id));
    }

    @GetMapping("/{id}/checkpoints")
    public List<CheckpointResponse> getCheckpoints(@PathVariable UUID id) {
        find(id);
        return sessionService.checkpoints(id).stream()
                .map(CheckpointResponse::from)
                .toList();
    }

    @GetMapping("/{id}/sandwiches")
    public List<SandwichResponse> getSandwiches(@PathVariable UUID id) {
        find(id);
        return corpus.sandwichesFor(id).stream()
                .map(SandwichResponse::from)
                .toList();
    }

    /**
     * Resume an interrupted session.
     *
     * HTTP 202 : the session was handed to a worker
     * HTTP 404 : session ID not found
     * HTTP 409 : the session has ended or is already running
     */
    @PostMapping("/{id}/resume")
    public ResponseEntity<SessionResponse> resume(@PathVariable UUID id) {
        SessionRecord session = find(id);
        if (session.isEnded()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Session " + id + " has ended: " + session.getEndReason());
        }
        if (!scheduler.resume(id)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Session " + id + " is already running");
        }
        return ResponseEntity.accepted().body(SessionResponse.from(session, true));
    }

    private SessionRecord find(UUID id) {
        return sessionService.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + id));
    }
}
