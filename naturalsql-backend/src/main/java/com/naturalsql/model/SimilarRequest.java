package com.naturalsql.model;

/**
 * A past successful request that resembles the current one.
 *
 * @param entry history entry
 * @param similarity word overlap with the current request, from 0 to 1
 */
public record SimilarRequest(HistoryEntry entry, double similarity) {
}
