package com.naturalsql.exception;

/**
 * Thrown when a table is not part of the current schema snapshot.
 */
public class TableNotFoundException extends NaturalSqlException {
    public TableNotFoundException(String table) {
        super(ErrorKind.UNKNOWN_TABLE, "Unknown table: " + table);
    }
}
