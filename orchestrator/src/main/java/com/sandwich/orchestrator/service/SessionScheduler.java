package com.sandwich.orchestrator.service;

import com.sandwich.orchestrator.error.ConfigurationException;
import com.sandwich.orchestrator.pipeline.PipelineProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * Runs sessions on a fixed worker pool, one worker thread per session.
 *
 * A session is never run by two workers at once: submissions for a session
 * that is already running are refused. Whatever escapes the runner ends the
 * session record so it does not look alive forever.
 */
@Component
public class SessionScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionScheduler.class);

    // Each worker drives one session at a time.
    // 4 workers = up to 4 concurrent sessions talking to the model and the sources.
    private static final int WORKER_COUNT = 4;

    private final ExecutorService workers;
    private final Set<UUID>       running = ConcurrentHashMap.newKeySet();

    private final SessionService     sessionService;
    private final PipelineRunner     runner;
    private final PipelineProperties config;

    @Autowired
    public SessionScheduler(SessionService sessionService, PipelineRunner runner, PipelineProperties config) {
        this(sessionService, runner, config, Executors.newFixedThreadPool(WORKER_COUNT));
    }

    SessionScheduler(SessionService sessionService, PipelineRunner runner,
                     PipelineProperties config, ExecutorService workers) {
        this.sessionService = sessionService;
        this.runner         = runner;
        this.config         = config;
        this.workers        = workers;
    }

    /**
     * Start a freshly created session in the background.
     *
     * @return false if the session is already running
     */
    public boolean start(UUID sessionId) {
        return submit(sessionId, runner::run);
    }

    /**
     * Resume an unfinished session from its latest checkpoint in the background.
     *
     * @return false if the session is already running
     */
    public boolean resume(UUID sessionId) {
        return submit(sessionId, runner::resume);
    }

    public boolean isRunning(UUID sessionId) {
        return running.contains(sessionId);
    }

    /** Pick up sessions a previous process left unfinished, if enabled. */
    @EventListener(ApplicationReadyEvent.class)
    public void resumeUnfinished() {
        if (!config.resumeOnStartup()) {
            return;
        }
        for (UUID id : sessionService.unfinishedSessionIds()) {
            log.info("Resuming unfinished session {}", id);
            resume(id);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping session workers ({} running)", running.size());
        workers.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private boolean submit(UUID sessionId, Function<UUID, ?> body) {
        if (!running.add(sessionId)) {
            log.warn("Session {} is already running", sessionId);
            return false;
        }
        workers.submit(() -> {
            try {
                body.apply(sessionId);
            } catch (ConfigurationException e) {
                log.error("Session {} cannot run: {}", sessionId, e.getMessage());
                endQuietly(sessionId, "configuration_error");
            } catch (Exception e) {
                log.error("Unhandled error in session {}: {}", sessionId, e.getMessage(), e);
                endQuietly(sessionId, "unhandled_error");
            } finally {
                running.remove(sessionId);
            }
        });
        return true;
    }

    private void endQuietly(UUID sessionId, String reason) {
        try {
            sessionService.end(sessionId, reason);
        } catch (RuntimeException e) {
            log.error("Could not mark session {} as ended: {}", sessionId, e.getMessage());
        }
    }
}
