package com.naturalsql.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of safety validation.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Verdict {
    private static final Verdict ACCEPT = new Verdict(true, null, "accepted");

    boolean accepted;
    RejectionReason reason;
    String message;

    public static Verdict accept() {
        return ACCEPT;
    }

    public static Verdict reject(RejectionReason reason, String message) {
        return new Verdict(false, reason, message);
    }
}
