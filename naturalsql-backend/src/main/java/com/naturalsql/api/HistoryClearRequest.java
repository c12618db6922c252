package com.naturalsql.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request DTO for clearing a session's history. Nothing is removed unless {@code confirm} is true.
 */
@Data
public class HistoryClearRequest {

    @NotBlank(message = "session_id is required")
    private String sessionId;

    private boolean confirm;
}
