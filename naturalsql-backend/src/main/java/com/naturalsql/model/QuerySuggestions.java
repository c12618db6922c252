package com.naturalsql.model;

import java.util.List;

/**
 * Suggested next requests plus past requests resembling the current one.
 *
 * @param suggestions request texts to offer
 * @param similarRequests past successful requests, best match first
 */
public record QuerySuggestions(List<String> suggestions, List<SimilarRequest> similarRequests) {
}
