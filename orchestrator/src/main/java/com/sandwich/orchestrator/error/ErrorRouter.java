package com.sandwich.orchestrator.error;

import com.sandwich.orchestrator.model.PipelineEvent;
import com.sandwich.orchestrator.observe.PipelineObserver;
import org.springframework.stereotype.Component;

/**
 * Maps a failed pipeline step onto the event that leaves ERROR_RECOVERY.
 *
 * Only an explicit FATAL kind ends the session. Content, parse and
 * exhausted-retry failures, and any kind added later, send the session back
 * to IDLE for another attempt.
 */
@Component
public class ErrorRouter {

    private final PipelineObserver observer;

    public ErrorRouter(PipelineObserver observer) {
        this.observer = observer;
    }

    /**
     * Classify a failure as {@link PipelineEvent#FATAL} or {@link PipelineEvent#RECOVERED}.
     * Reports exactly one diagnostic per call to the observer.
     */
    public PipelineEvent classify(PipelineException failure) {
        PipelineEvent event = switch (failure.getKind()) {
            case FATAL -> PipelineEvent.FATAL;
            case CONTENT, PARSE, RETRYABLE, OTHER -> PipelineEvent.RECOVERED;
        };
        observer.failureClassified(failure, event);
        return event;
    }
}
