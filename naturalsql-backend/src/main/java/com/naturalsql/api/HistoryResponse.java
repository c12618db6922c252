package com.naturalsql.api;

import com.naturalsql.model.HistoryEntry;
import com.naturalsql.model.HistoryStats;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HistoryResponse {
    private List<HistoryEntry> entries;
    private HistoryStats stats;
}
