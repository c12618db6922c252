package com.naturalsql.exception;

/**
 * Thrown when the in-flight request was cancelled by the caller.
 */
public class RequestCancelledException extends NaturalSqlException {
    public RequestCancelledException(String message, Throwable cause) {
        super(ErrorKind.CANCELLED, message, cause);
    }
}
