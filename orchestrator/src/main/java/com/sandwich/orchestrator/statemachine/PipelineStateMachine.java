package com.sandwich.orchestrator.statemachine;

import com.sandwich.orchestrator.model.PipelineEvent;
import com.sandwich.orchestrator.model.PipelineState;
import com.sandwich.orchestrator.observe.PipelineObserver;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * State machine for one session.
 *
 * Enforces {@link TransitionTable} and records every transition as an
 * immutable {@link Checkpoint}, both in an in-memory log and in the
 * {@link CheckpointSink}. The checkpoint log is append-only; callers only
 * ever see copies of it.
 *
 * All methods synchronize on the instance, so one machine may be shared
 * between threads: a transition either happens completely (checkpoint
 * appended, sink written, state advanced) or not at all.
 */
public class PipelineStateMachine {

    private final CheckpointSink   sink;
    private final PipelineObserver observer;
    private final List<Checkpoint> checkpoints = new ArrayList<>();

    private UUID          sessionId;
    private PipelineState currentState = PipelineState.IDLE;

    public PipelineStateMachine(UUID sessionId, CheckpointSink sink, PipelineObserver observer) {
        this.sessionId = sessionId;
        this.sink      = sink;
        this.observer  = observer;
    }

    public synchronized UUID sessionId() {
        return sessionId;
    }

    public synchronized PipelineState currentState() {
        return currentState;
    }

    public synchronized boolean isTerminal() {
        return TransitionTable.isTerminal(currentState);
    }

    /** Whether {@code event} is legal in the current state. No side effects. */
    public synchronized boolean canTransition(PipelineEvent event) {
        return TransitionTable.next(currentState, event).isPresent();
    }

    public PipelineState transition(PipelineEvent event) {
        return transition(event, Map.of());
    }

    /**
     * Apply {@code event}.
     *
     * The checkpoint is written to the sink before the state advances; if the
     * sink throws, the machine stays where it was.
     *
     * @param payload state-specific context stored with the checkpoint
     * @return the new current state
     * @throws InvalidTransitionException if {@code event} is illegal in the current state
     */
    public synchronized PipelineState transition(PipelineEvent event, Map<String, Object> payload) {
        PipelineState from = currentState;
        PipelineState to = TransitionTable.next(from, event)
                .orElseThrow(() -> new InvalidTransitionException(
                        from, event, TransitionTable.legalEvents(from)));

        Checkpoint checkpoint = Checkpoint.forTransition(sessionId, from, event, to, payload);
        sink.append(checkpoint);
        checkpoints.add(checkpoint);
        currentState = to;

        observer.transitioned(from, event, checkpoint);
        return to;
    }

    /**
     * Restore state and session id from a checkpoint taken earlier, possibly
     * by another machine before a crash.
     *
     * No transition is validated and nothing is written to the sink (the
     * checkpoint is already stored); it is appended to the in-memory log so
     * {@link #latestCheckpoint()} sees it.
     */
    public synchronized void recoverFromCheckpoint(Checkpoint checkpoint) {
        this.currentState = checkpoint.state();
        this.sessionId    = checkpoint.sessionId();
        checkpoints.add(checkpoint);
        observer.recovered(checkpoint);
    }

    public synchronized Optional<Checkpoint> latestCheckpoint() {
        return checkpoints.isEmpty()
                ? Optional.empty()
                : Optional.of(checkpoints.get(checkpoints.size() - 1));
    }

    /** Snapshot of the checkpoint log, oldest first. */
    public synchronized List<Checkpoint> checkpoints() {
        return List.copyOf(checkpoints);
    }
}
