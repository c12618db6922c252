package com.naturalsql.model;

import java.time.OffsetDateTime;

/**
 * Token for one live connection. A handle from a replaced connection is stale and is refused.
 *
 * @param connectionId identity of the descriptor it was opened for
 * @param generation   connect counter within the session
 * @param openedAt     when the connection was opened
 */
public record ConnectionHandle(String connectionId, long generation, OffsetDateTime openedAt) {
}
