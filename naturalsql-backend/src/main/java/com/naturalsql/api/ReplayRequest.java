package com.naturalsql.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ReplayRequest {
    @NotBlank(message = "session_id is required")
    private String sessionId;

    @NotNull(message = "sequence is required")
    private Long sequence;
}
