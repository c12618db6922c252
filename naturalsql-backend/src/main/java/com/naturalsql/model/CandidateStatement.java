package com.naturalsql.model;

import net.sf.jsqlparser.statement.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Unvalidated SQL produced by the compiler, together with what was extracted from it.
 *
 * @param sql         statement text without trailing semicolon
 * @param params      values bound to the {@code ?} placeholders, in order
 * @param kind        classified kind
 * @param tables      referenced tables, unquoted and without schema prefix
 * @param statement   parsed statement
 * @param requestText request the statement was compiled from
 */
public record CandidateStatement(
        String sql,
        List<Object> params,
        StatementKind kind,
        List<String> tables,
        Statement statement,
        String requestText
) {
    public CandidateStatement {
        params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
        tables = List.copyOf(tables);
    }
}
