package com.naturalsql.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectResponse {
    private String sessionId;
    private boolean connected;
    private String detail;
    private String engine;
    private String host;
    private String database;
    private OffsetDateTime expiresAt;
}
