package com.naturalsql.api;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
public class QueryResponse {
    private String sql;
    private List<Object> params;
    private List<String> columns;
    private List<Map<String, Object>> rows;
    private int rowCount;
    private boolean truncated;
    private boolean fromCache;
    private long executionMs;
    private List<String> warnings;
}
