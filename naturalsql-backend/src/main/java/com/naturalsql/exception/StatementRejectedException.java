package com.naturalsql.exception;

import com.naturalsql.model.Verdict;

/**
 * Thrown when the safety validator rejects a candidate statement. Never retried.
 */
public class StatementRejectedException extends NaturalSqlException {

    private final transient Verdict verdict;
    private final String sql;

    /**
     * Create a new exception from a rejecting verdict.
     *
     * @param verdict rejecting verdict
     * @param sql the rejected SQL text
     */
    public StatementRejectedException(Verdict verdict, String sql) {
        super(verdict.getReason().getErrorKind(), verdict.getMessage());
        this.verdict = verdict;
        this.sql = sql;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public String getSql() {
        return sql;
    }
}
