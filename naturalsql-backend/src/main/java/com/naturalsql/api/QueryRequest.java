package com.naturalsql.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class QueryRequest {
    @NotBlank(message = "session_id is required")
    private String sessionId;

    /**
     * Natural-language question, e.g. "show me orders from last week".
     */
    @NotBlank(message = "request_text is required")
    private String requestText;
}
