package com.naturalsql.compiler;

import com.naturalsql.model.StatementKind;

/**
 * Prompt sent to the language model.
 *
 * @param system       system message fixing the output contract
 * @param user         user message: request, schema context and history
 * @param requestText  the original request
 * @param expectedKind statement kind the caller asked for, or {@code null} for any
 * @param attempt      1 for the first call, 2 for the clarifying retry
 */
public record Prompt(String system, String user, String requestText, StatementKind expectedKind, int attempt) {

    /**
     * Derive the follow-up prompt used after a reply could not be parsed.
     *
     * @param reason why the previous reply was unusable
     * @return clarifying prompt
     */
    public Prompt withClarification(String reason) {
        String clarified = user
                + "\n\nYour previous reply could not be used: " + reason + "\n"
                + "Reply again with exactly one SQL statement in the required JSON format.";
        return new Prompt(system, clarified, requestText, expectedKind, attempt + 1);
    }
}
