package com.naturalsql.exception;

/**
 * Thrown when the database is unreachable or rejects the credentials.
 */
public class ConnectionException extends NaturalSqlException {
    public ConnectionException(String message, Throwable cause) {
        super(ErrorKind.CONNECTION_ERROR, message, cause);
    }
}
