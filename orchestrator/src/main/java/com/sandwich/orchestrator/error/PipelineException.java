package com.sandwich.orchestrator.error;

/**
 * Thrown by a pipeline step when it fails in a way the session should react to
 * (content unusable, response undecodable, retries exhausted, backing store
 * down).
 *
 * Unchecked, like the other orchestrator exceptions: the session runner
 * catches it around each step and hands it to {@link ErrorRouter}, which
 * turns the kind into a state-machine event.
 */
public class PipelineException extends RuntimeException {

    public enum Kind { FATAL, CONTENT, PARSE, RETRYABLE, OTHER }

    private final Kind   kind;
    private final String reason;
    private final int    attempts;

    public PipelineException(Kind kind, String reason, String message) {
        this(kind, reason, message, 1, null);
    }

    public PipelineException(Kind kind, String reason, String message, Throwable cause) {
        this(kind, reason, message, 1, cause);
    }

    /**
     * @param attempts how many times the raiser tried before giving up;
     *                 meaningful for {@link Kind#RETRYABLE}
     */
    public PipelineException(Kind kind, String reason, String message, int attempts, Throwable cause) {
        super("[" + kind + "/" + reason + "] " + message, cause);
        this.kind     = kind;
        this.reason   = reason;
        this.attempts = attempts;
    }

    public static PipelineException fatal(String reason, String message, Throwable cause) {
        return new PipelineException(Kind.FATAL, reason, message, cause);
    }

    public static PipelineException content(String reason, String message) {
        return new PipelineException(Kind.CONTENT, reason, message);
    }

    public static PipelineException parse(String message, Throwable cause) {
        return new PipelineException(Kind.PARSE, "parse_error", message, cause);
    }

    public static PipelineException retriesExhausted(String reason, String message, int attempts, Throwable cause) {
        return new PipelineException(Kind.RETRYABLE, reason, message, attempts, cause);
    }

    public Kind   getKind()     { return kind; }

    /** Machine-readable reason code, e.g. "rate_limit" or "database_unavailable". */
    public String getReason()   { return reason; }

    public int    getAttempts() { return attempts; }
}
