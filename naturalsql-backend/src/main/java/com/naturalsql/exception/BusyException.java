package com.naturalsql.exception;

/**
 * Thrown when a statement is already running on the session's connection.
 */
public class BusyException extends NaturalSqlException {
    public BusyException(String message) {
        super(ErrorKind.BUSY, message);
    }
}
