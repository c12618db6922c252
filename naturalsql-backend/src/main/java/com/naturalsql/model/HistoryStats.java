package com.naturalsql.model;

/**
 * Aggregate counters over a session's history.
 *
 * @param total           entries currently held
 * @param successful      successful entries
 * @param failed          failed entries
 * @param successRate     successful / total, 0 when empty
 * @param averageExecutionMs mean duration of successful entries
 */
public record HistoryStats(int total, int successful, int failed, double successRate, double averageExecutionMs) {
}
