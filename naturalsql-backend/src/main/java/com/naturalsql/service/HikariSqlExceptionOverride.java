package com.naturalsql.service;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTimeoutException;

/**
 * Keeps the session's single pooled connection alive across statement-level failures.
 *
 * <p>Syntax errors, constraint violations, timeouts and cancellations are errors of one statement, not of the
 * connection, so they must not evict it. Connection-class SQLSTATEs ({@code 08xxx}) still evict.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    /**
     * Decide whether Hikari should evict a connection based on the exception.
     *
     * @param sqlException SQL exception
     * @return override decision
     */
    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }
        if (sqlException instanceof SQLFeatureNotSupportedException
                || sqlException instanceof SQLSyntaxErrorException
                || sqlException instanceof SQLTimeoutException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState == null) {
            return Override.CONTINUE_EVICT;
        }
        if (sqlState.startsWith("08")) {
            return Override.CONTINUE_EVICT;
        }
        // 0A: feature not supported, 22: data exception, 23: integrity constraint, 42: syntax/access, 57014: cancelled
        if (sqlState.startsWith("0A") || sqlState.startsWith("22") || sqlState.startsWith("23")
                || sqlState.startsWith("42") || "57014".equals(sqlState)) {
            return Override.DO_NOT_EVICT;
        }
        return Override.CONTINUE_EVICT;
    }
}
