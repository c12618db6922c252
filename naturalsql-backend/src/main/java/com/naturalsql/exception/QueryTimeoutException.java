package com.naturalsql.exception;

import java.util.Locale;

/**
 * Thrown when the model call or the database call exceeds its timeout.
 */
public class QueryTimeoutException extends NaturalSqlException {

    /**
     * Phase in which the timeout occurred.
     */
    public enum Phase {
        COMPILATION,
        EXECUTION
    }

    private final Phase phase;

    public QueryTimeoutException(Phase phase, long timeoutMs, Throwable cause) {
        super(ErrorKind.TIMEOUT, phase.name().toLowerCase(Locale.ROOT) + " timed out after " + timeoutMs + " ms", cause);
        this.phase = phase;
    }

    public Phase getPhase() {
        return phase;
    }
}
