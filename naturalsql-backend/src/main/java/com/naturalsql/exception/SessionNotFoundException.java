package com.naturalsql.exception;

/**
 * Thrown when a session_id is missing or expired.
 */
public class SessionNotFoundException extends NaturalSqlException {
    public SessionNotFoundException(String sessionId) {
        super(ErrorKind.SESSION_NOT_FOUND, "Session missing or expired: " + sessionId);
    }
}
