package com.naturalsql.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class MutateRequest {
    @NotBlank(message = "session_id is required")
    private String sessionId;

    @NotBlank(message = "request_text is required")
    private String requestText;

    /**
     * insert | update | delete
     */
    @NotBlank(message = "kind is required")
    private String kind;
}
