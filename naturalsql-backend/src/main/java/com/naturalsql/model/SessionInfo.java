package com.naturalsql.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class SessionInfo {
    private String sessionId;
    private OffsetDateTime createdAt;
    private OffsetDateTime lastAccessedAt;
    private OffsetDateTime expiresAt;
}
