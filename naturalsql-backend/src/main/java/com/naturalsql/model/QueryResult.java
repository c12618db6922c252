package com.naturalsql.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of one executed statement. Exists only for accepted statements that executed successfully.
 */
@Value
@Builder(toBuilder = true)
public class QueryResult {
    String sql;
    @Builder.Default
    List<Object> params = List.of();
    StatementKind kind;
    @Builder.Default
    List<String> columns = List.of();
    @Builder.Default
    List<Map<String, Object>> rows = List.of();
    int rowCount;
    int affectedRows;
    boolean truncated;
    boolean fromCache;
    long executionMs;
    @Builder.Default
    List<String> warnings = List.of();

    /**
     * Copy of this result as served from the query cache.
     *
     * @return result flagged {@code fromCache}
     */
    public QueryResult asCached() {
        return fromCache ? this : toBuilder().fromCache(true).build();
    }

    public QueryResult withWarnings(List<String> lintWarnings) {
        return toBuilder().warnings(List.copyOf(lintWarnings)).build();
    }
}
