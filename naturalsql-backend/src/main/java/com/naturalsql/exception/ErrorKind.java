package com.naturalsql.exception;

/**
 * Typed failure reasons surfaced to callers as {@code error_kind}.
 */
public enum ErrorKind {
    CONNECTION_ERROR,
    CONNECTION_INACTIVE,
    SESSION_NOT_FOUND,
    COMPILATION_ERROR,
    LLM_DISABLED,
    DISALLOWED_STATEMENT_KIND,
    MISSING_FILTER_PREDICATE,
    UNKNOWN_TABLE,
    UNPARAMETERIZED_LITERAL,
    ENGINE_REJECTED,
    EXECUTION_ERROR,
    TIMEOUT,
    BUSY,
    CANCELLED
}
