package com.naturalsql.exception;

/**
 * Thrown when an operation needs a live connection and the session has none (or the handle is stale).
 */
public class ConnectionInactiveException extends NaturalSqlException {
    public ConnectionInactiveException(String message) {
        super(ErrorKind.CONNECTION_INACTIVE, message);
    }
}
