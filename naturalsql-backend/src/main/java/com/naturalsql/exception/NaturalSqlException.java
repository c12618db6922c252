package com.naturalsql.exception;

/**
 * Base class for every pipeline failure. Each failure carries the {@link ErrorKind} it is reported as.
 */
public class NaturalSqlException extends RuntimeException {

    private final ErrorKind kind;

    /**
     * Create a new exception.
     *
     * @param kind error kind
     * @param message error message
     */
    public NaturalSqlException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Create a new exception with a cause.
     *
     * @param kind error kind
     * @param message error message
     * @param cause underlying cause
     */
    public NaturalSqlException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
