package com.naturalsql.api;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class MutateResponse {
    private String sql;
    private List<Object> params;
    private int affectedRows;
    private long executionMs;
}
