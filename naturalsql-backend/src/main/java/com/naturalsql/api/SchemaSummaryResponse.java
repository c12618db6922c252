package com.naturalsql.api;

import com.naturalsql.model.TableSummary;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SchemaSummaryResponse {
    private int tableCount;
    private List<TableSummary> tables;
}
