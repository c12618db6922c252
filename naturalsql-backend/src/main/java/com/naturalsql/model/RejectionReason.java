package com.naturalsql.model;

import com.naturalsql.exception.ErrorKind;

/**
 * Safety rules, in the order they are applied.
 */
public enum RejectionReason {
    DISALLOWED_STATEMENT_KIND(ErrorKind.DISALLOWED_STATEMENT_KIND),
    MISSING_FILTER_PREDICATE(ErrorKind.MISSING_FILTER_PREDICATE),
    UNKNOWN_TABLE(ErrorKind.UNKNOWN_TABLE),
    UNPARAMETERIZED_LITERAL(ErrorKind.UNPARAMETERIZED_LITERAL);

    private final ErrorKind errorKind;

    RejectionReason(ErrorKind errorKind) {
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
