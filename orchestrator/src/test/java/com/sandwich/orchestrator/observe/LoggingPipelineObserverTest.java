package com.sandwich.orchestrator.observe;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.sandwich.orchestrator.error.PipelineException;
import com.sandwich.orchestrator.model.PipelineEvent;
import com.sandwich.orchestrator.model.PipelineState;
import com.sandwich.orchestrator.statemachine.Checkpoint;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Log lines are captured with a Logback ListAppender; counters are read
 * back from a SimpleMeterRegistry.
 */
class LoggingPipelineObserverTest {

    SimpleMeterRegistry           registry;
    LoggingPipelineObserver       observer;
    ListAppender<ILoggingEvent>   appender;
    Logger                        logger;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        observer = new LoggingPipelineObserver(registry);
        logger   = (Logger) LoggerFactory.getLogger(LoggingPipelineObserver.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    @Test
    void transitioned_logsReasonAndCountsByFromEventTo() {
        Checkpoint cp = Checkpoint.forTransition(UUID.randomUUID(),
                PipelineState.IDLE, PipelineEvent.START_FORAGING, PipelineState.FORAGING, Map.of());

        observer.transitioned(PipelineState.IDLE, PipelineEvent.START_FORAGING, cp);

        assertThat(registry.get("sandwich.pipeline.transitions")
                .tags("from", "idle", "event", "start_foraging", "to", "foraging")
                .counter().count()).isEqualTo(1.0);
        assertThat(appender.list).singleElement()
                .extracting(ILoggingEvent::getFormattedMessage)
                .asString().contains("idle --[start_foraging]--> foraging");
    }

    @Test
    void transitioned_turkishDefaultLocale_keepsAsciiNames() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            Checkpoint cp = Checkpoint.forTransition(UUID.randomUUID(),
                    PipelineState.IDLE, PipelineEvent.START_FORAGING, PipelineState.FORAGING, Map.of());

            observer.transitioned(PipelineState.IDLE, PipelineEvent.START_FORAGING, cp);

            assertThat(cp.transitionReason()).isEqualTo("idle --[start_foraging]--> foraging");
            assertThat(registry.get("sandwich.pipeline.transitions")
                    .tags("from", "idle", "event", "start_foraging", "to", "foraging")
                    .counter().count()).isEqualTo(1.0);
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void failureClassified_fatalIsLoggedAtError() {
        observer.failureClassified(PipelineException.fatal("auth_error", "bad key", null), PipelineEvent.FATAL);

        assertThat(appender.list).singleElement()
                .extracting(ILoggingEvent::getLevel).isEqualTo(Level.ERROR);
        assertThat(registry.get("sandwich.pipeline.failures")
                .tags("kind", "fatal", "event", "fatal").counter().count()).isEqualTo(1.0);
    }

    @Test
    void failureClassified_retryableIsLoggedAtWarnWithAttempts() {
        observer.failureClassified(
                PipelineException.retriesExhausted("rate_limit", "429", 4, null), PipelineEvent.RECOVERED);

        ILoggingEvent event = appender.list.get(0);
        assertThat(event.getLevel()).isEqualTo(Level.WARN);
        assertThat(event.getFormattedMessage()).contains("after 4 attempts").contains("rate_limit");
    }

    @Test
    void tierChanged_countsDirection() {
        observer.tierChanged(1, 2, 5);
        observer.tierChanged(2, 1, 3);
        observer.tierChanged(1, 2, 5);

        assertThat(registry.get("sandwich.forager.tier.changes")
                .tag("direction", "promotion").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("sandwich.forager.tier.changes")
                .tag("direction", "demotion").counter().count()).isEqualTo(1.0);
    }

    @Test
    void recovered_countsByState() {
        Checkpoint cp = new Checkpoint(UUID.randomUUID(), UUID.randomUUID(), PipelineState.SELECTING,
                java.time.Instant.now(), Map.of(), "identifying --[candidates_found]--> selecting");

        observer.recovered(cp);

        assertThat(registry.get("sandwich.pipeline.recoveries")
                .tag("state", "selecting").counter().count()).isEqualTo(1.0);
    }
}
