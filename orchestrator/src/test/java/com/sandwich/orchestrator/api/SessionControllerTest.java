package com.sandwich.orchestrator.api;

import com.sandwich.orchestrator.corpus.SandwichCorpus;
import com.sandwich.orchestrator.model.AssembledSandwich;
import com.sandwich.orchestrator.model.PipelineState;
import com.sandwich.orchestrator.model.SandwichRecord;
import com.sandwich.orchestrator.model.SandwichStatus;
import com.sandwich.orchestrator.model.SessionRecord;
import com.sandwich.orchestrator.service.SessionScheduler;
import com.sandwich.orchestrator.service.SessionService;
import com.sandwich.orchestrator.statemachine.Checkpoint;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for SessionController.
 *
 * @WebMvcTest spins up only the web layer (no DB, no workers, no model calls).
 */
@WebMvcTest(SessionController.class)
class SessionControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean SessionService   sessionService;
    @MockitoBean SessionScheduler scheduler;
    @MockitoBean SandwichCorpus   corpus;

    // ------------------------------------------------------------------
    // POST /sessions
    // ------------------------------------------------------------------

    @Test
    void start_withLimits_returns201AndSchedules() throws Exception {
        SessionRecord session = fakeSession(3, 30);
        when(sessionService.create(3, 30)).thenReturn(session);
        when(scheduler.start(session.getId())).thenReturn(true);

        mockMvc.perform(post("/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"maxSandwiches":3,"maxDurationMinutes":30}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(session.getId().toString()))
                .andExpect(jsonPath("$.state").value("idle"))
                .andExpect(jsonPath("$.maxSandwiches").value(3))
                .andExpect(jsonPath("$.running").value(true));

        verify(scheduler).start(session.getId());
    }

    @Test
    void start_withoutBody_createsUnlimitedSession() throws Exception {
        SessionRecord session = fakeSession(null, null);
        when(sessionService.create(null, null)).thenReturn(session);

        mockMvc.perform(post("/sessions"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.maxSandwiches").isEmpty());
    }

    @Test
    void start_invalidLimit_returns400() throws Exception {
        when(sessionService.create(0, null))
                .thenThrow(new IllegalArgumentException("maxSandwiches must be positive, got 0"));

        mockMvc.perform(post("/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"maxSandwiches\":0}"))
                .andExpect(status().isBadRequest());

        verify(scheduler, never()).start(any());
    }

    // ------------------------------------------------------------------
    // GET /sessions/{id}
    // ------------------------------------------------------------------

    @Test
    void getSession_existingId_returns200WithStatistics() throws Exception {
        SessionRecord session = fakeSession(5, null);
        session.setState(PipelineState.SELECTING);
        session.setSandwichesMade(2);
        session.setForagingAttempts(6);
        when(sessionService.findById(session.getId())).thenReturn(Optional.of(session));
        when(scheduler.isRunning(session.getId())).thenReturn(true);

        mockMvc.perform(get("/sessions/{id}", session.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("selecting"))
                .andExpect(jsonPath("$.sandwichesMade").value(2))
                .andExpect(jsonPath("$.foragingAttempts").value(6))
                .andExpect(jsonPath("$.running").value(true));
    }

    @Test
    void getSession_unknownId_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(sessionService.findById(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/sessions/{id}", unknown))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // GET /sessions/{id}/checkpoints and /sandwiches
    // ------------------------------------------------------------------

    @Test
    void getCheckpoints_existingSession_returnsTransitionLog() throws Exception {
        SessionRecord session = fakeSession(null, null);
        when(sessionService.findById(session.getId())).thenReturn(Optional.of(session));
        Checkpoint cp = new Checkpoint(UUID.randomUUID(), session.getId(), PipelineState.FORAGING,
                Instant.now(), Map.of("tier", 1), "idle --[start_foraging]--> foraging");
        when(sessionService.checkpoints(session.getId())).thenReturn(List.of(cp));

        mockMvc.perform(get("/sessions/{id}/checkpoints", session.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].state").value("foraging"))
                .andExpect(jsonPath("$[0].transitionReason").value("idle --[start_foraging]--> foraging"))
                .andExpect(jsonPath("$[0].payload.tier").value(1));
    }

    @Test
    void getCheckpoints_unknownSession_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(sessionService.findById(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/sessions/{id}/checkpoints", unknown))
                .andExpect(status().isNotFound());

        verify(sessionService, never()).checkpoints(any());
    }

    @Test
    void getSandwiches_existingSession_omitsEmbedding() throws Exception {
        SessionRecord session = fakeSession(null, null);
        when(sessionService.findById(session.getId())).thenReturn(Optional.of(session));
        AssembledSandwich sandwich = new AssembledSandwich("The Squeeze", "Two bounds press a limit into place.",
                "g(x)", "f(x)", "h(x)", "bound");
        when(corpus.sandwichesFor(session.getId())).thenReturn(List.of(
                new SandwichRecord(session.getId(), sandwich, 0.82, SandwichStatus.ACCEPTED,
                        "https://en.wikipedia.org/wiki/Squeeze_theorem", "[0.1,0.2]")));

        mockMvc.perform(get("/sessions/{id}/sandwiches", session.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("The Squeeze"))
                .andExpect(jsonPath("$[0].status").value("ACCEPTED"))
                .andExpect(jsonPath("$[0].validityScore").value(0.82))
                .andExpect(jsonPath("$[0].embeddingJson").doesNotExist());
    }

    // ------------------------------------------------------------------
    // POST /sessions/{id}/resume
    // ------------------------------------------------------------------

    @Test
    void resume_interruptedSession_returns202() throws Exception {
        SessionRecord session = fakeSession(null, null);
        when(sessionService.findById(session.getId())).thenReturn(Optional.of(session));
        when(scheduler.resume(session.getId())).thenReturn(true);

        mockMvc.perform(post("/sessions/{id}/resume", session.getId()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.running").value(true));
    }

    @Test
    void resume_endedSession_returns409() throws Exception {
        SessionRecord session = fakeSession(null, null);
        session.setEndedAt(Instant.now());
        session.setEndReason("max_sandwiches");
        when(sessionService.findById(session.getId())).thenReturn(Optional.of(session));

        mockMvc.perform(post("/sessions/{id}/resume", session.getId()))
                .andExpect(status().isConflict());

        verify(scheduler, never()).resume(any());
    }

    @Test
    void resume_alreadyRunning_returns409() throws Exception {
        SessionRecord session = fakeSession(null, null);
        when(sessionService.findById(session.getId())).thenReturn(Optional.of(session));
        when(scheduler.resume(session.getId())).thenReturn(false);

        mockMvc.perform(post("/sessions/{id}/resume", session.getId()))
                .andExpect(status().isConflict());
    }

    @Test
    void resume_unknownSession_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(sessionService.findById(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(post("/sessions/{id}/resume", unknown))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private SessionRecord fakeSession(Integer maxSandwiches, Integer maxDurationMinutes) {
        return new SessionRecord(UUID.randomUUID(), maxSandwiches, maxDurationMinutes);
    }
}
