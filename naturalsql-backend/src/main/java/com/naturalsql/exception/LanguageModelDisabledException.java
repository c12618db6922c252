package com.naturalsql.exception;

/**
 * Thrown when SQL compilation is requested but no language model is configured.
 */
public class LanguageModelDisabledException extends CompilationException {
    public LanguageModelDisabledException(String message) {
        super(ErrorKind.LLM_DISABLED, message);
    }
}
