package com.naturalsql.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SchemaRefreshResponse {
    private List<String> tables;
    private OffsetDateTime takenAt;
}
