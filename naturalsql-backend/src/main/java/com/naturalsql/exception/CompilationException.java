package com.naturalsql.exception;

/**
 * Thrown when the language model produced no usable SQL statement.
 */
public class CompilationException extends NaturalSqlException {

    public CompilationException(String message) {
        super(ErrorKind.COMPILATION_ERROR, message);
    }

    public CompilationException(String message, Throwable cause) {
        super(ErrorKind.COMPILATION_ERROR, message, cause);
    }

    protected CompilationException(ErrorKind kind, String message) {
        super(kind, message);
    }
}
