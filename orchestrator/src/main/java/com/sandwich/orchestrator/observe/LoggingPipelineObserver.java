package com.sandwich.orchestrator.observe;

import com.sandwich.orchestrator.error.PipelineException;
import com.sandwich.orchestrator.model.PipelineEvent;
import com.sandwich.orchestrator.model.PipelineState;
import com.sandwich.orchestrator.statemachine.Checkpoint;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Default observer: one log line and one counter increment per diagnostic.
 *
 * Metrics:
 * <pre>
 *   sandwich.pipeline.transitions{from, event, to}
 *   sandwich.pipeline.recoveries{state}
 *   sandwich.pipeline.failures{kind, event}
 *   sandwich.forager.tier.changes{direction="promotion|demotion"}
 * </pre>
 *
 * Fatal failures are logged at ERROR, every other failure at WARN.
 */
@Component
public class LoggingPipelineObserver implements PipelineObserver {

    private static final Logger log = LoggerFactory.getLogger(LoggingPipelineObserver.class);

    private final MeterRegistry meterRegistry;

    public LoggingPipelineObserver(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void transitioned(PipelineState from, PipelineEvent event, Checkpoint checkpoint) {
        log.info("Session {} transition: {}", checkpoint.sessionId(), checkpoint.transitionReason());
        meterRegistry.counter("sandwich.pipeline.transitions",
                "from", from.value(), "event", event.value(), "to", checkpoint.state().value()).increment();
    }

    @Override
    public void recovered(Checkpoint checkpoint) {
        log.info("Session {} recovered to state {} from checkpoint {}",
                checkpoint.sessionId(), checkpoint.state().value(), checkpoint.id());
        meterRegistry.counter("sandwich.pipeline.recoveries",
                "state", checkpoint.state().value()).increment();
    }

    @Override
    public void failureClassified(PipelineException failure, PipelineEvent event) {
        if (event == PipelineEvent.FATAL) {
            log.error("Fatal failure: {} (reason={})", failure.getMessage(), failure.getReason());
        } else if (failure.getKind() == PipelineException.Kind.RETRYABLE) {
            log.warn("Retryable failure after {} attempts: {} (reason={})",
                    failure.getAttempts(), failure.getMessage(), failure.getReason());
        } else {
            log.warn("{} failure: {} (reason={})",
                    failure.getKind(), failure.getMessage(), failure.getReason());
        }
        meterRegistry.counter("sandwich.pipeline.failures",
                "kind", failure.getKind().name().toLowerCase(Locale.ROOT), "event", event.value()).increment();
    }

    @Override
    public void tierChanged(int fromTier, int toTier, int streak) {
        String direction = toTier > fromTier ? "promotion" : "demotion";
        log.info("Tier {}: {} -> {} (after {} consecutive {})",
                direction, fromTier, toTier, streak, toTier > fromTier ? "successes" : "failures");
        meterRegistry.counter("sandwich.forager.tier.changes", "direction", direction).increment();
    }
}
