package com.naturalsql.config;

import java.util.Locale;

/**
 * What a request does when another statement is running on the same connection.
 */
public enum BusyPolicy {
    WAIT,
    FAIL;

    public static BusyPolicy fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            return WAIT;
        }
        return "fail".equals(raw.trim().toLowerCase(Locale.ROOT)) ? FAIL : WAIT;
    }
}
