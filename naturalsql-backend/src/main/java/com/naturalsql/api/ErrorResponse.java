package com.naturalsql.api;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ErrorResponse {
    private String errorKind;
    private String message;
    private String details;
    private String traceId;
}
