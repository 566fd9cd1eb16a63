package com.sandwich.orchestrator.error;

/**
 * Thrown when the orchestrator is wired in a way it cannot run with
 * (e.g. no content source enabled at any tier).
 *
 * Never routed through the state machine; it propagates to whoever started
 * the session.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
