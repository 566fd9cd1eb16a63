package com.sandwich.orchestrator.source;

/**
 * Thrown when a content source cannot be reached or answers with an error.
 *
 * The forager absorbs it and treats the fetch as "nothing found".
 */
public class SourceException extends RuntimeException {

    public SourceException(String message) {
        super(message);
    }

    public SourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
