package com.naturalsql.exception;

/**
 * Thrown when the database rejects a statement that passed validation. The message is the engine's, verbatim.
 */
public class EngineRejectedException extends NaturalSqlException {

    private final String sqlState;

    public EngineRejectedException(String message, String sqlState, Throwable cause) {
        super(ErrorKind.ENGINE_REJECTED, message, cause);
        this.sqlState = sqlState;
    }

    public String getSqlState() {
        return sqlState;
    }
}
