package com.naturalsql.service;

import com.naturalsql.util.Digests;

import java.util.Locale;

/**
 * Query cache key: the connection identity plus a digest of the normalized request.
 *
 * @param connectionId connection identity
 * @param digest SHA-256 of identity and normalized request text
 */
public record CacheKey(String connectionId, String digest) {

    public static CacheKey of(String connectionId, String requestText) {
        return new CacheKey(connectionId, Digests.sha256Hex(connectionId + "\n" + normalize(requestText)));
    }

    /**
     * Trim, lower-case and collapse whitespace.
     *
     * @param requestText request text
     * @return normalized text
     */
    static String normalize(String requestText) {
        if (requestText == null) {
            return "";
        }
        return requestText.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
