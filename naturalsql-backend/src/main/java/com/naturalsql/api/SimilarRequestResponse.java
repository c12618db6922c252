package com.naturalsql.api;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class SimilarRequestResponse {
    private long sequence;
    private String requestText;
    private String sql;
    private int rowCount;
    private long executionMs;
    private OffsetDateTime timestamp;
    private double similarity;
}
