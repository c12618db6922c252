package com.naturalsql.model;

import com.naturalsql.exception.ErrorKind;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * One recorded request outcome.
 */
@Value
@Builder(toBuilder = true)
public class HistoryEntry {
    long sequence;
    String requestText;
    String sql;
    @Builder.Default
    List<Object> params = List.of();
    StatementKind kind;
    @Builder.Default
    List<String> tables = List.of();
    RejectionReason rejection;
    boolean success;
    ErrorKind errorKind;
    String errorMessage;
    int rowCount;
    int affectedRows;
    long executionMs;
    OffsetDateTime timestamp;
}
