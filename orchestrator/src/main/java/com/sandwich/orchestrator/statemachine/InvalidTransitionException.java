package com.sandwich.orchestrator.statemachine;

import com.sandwich.orchestrator.model.PipelineEvent;
import com.sandwich.orchestrator.model.PipelineState;

import java.util.Set;

/**
 * Thrown when an event is not legal in the state machine's current state.
 *
 * This is a caller bug, never a runtime condition to recover from, so the
 * session runner does not catch it.
 */
public class InvalidTransitionException extends IllegalStateException {

    private final PipelineState       currentState;
    private final PipelineEvent       event;
    private final Set<PipelineEvent>  legalEvents;

    public InvalidTransitionException(PipelineState currentState, PipelineEvent event,
                                      Set<PipelineEvent> legalEvents) {
        super("Invalid transition: " + currentState.value() + " + '" + event.value()
                + "' (valid events: " + legalEvents + ")");
        this.currentState = currentState;
        this.event        = event;
        this.legalEvents  = Set.copyOf(legalEvents);
    }

    public PipelineState      getCurrentState() { return currentState; }
    public PipelineEvent      getEvent()        { return event; }
    public Set<PipelineEvent> getLegalEvents()  { return legalEvents; }
}
